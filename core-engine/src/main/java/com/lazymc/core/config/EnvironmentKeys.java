package com.lazymc.core.config;

/**
 * Names of the environment variables read when no configuration file exists.
 *
 * <p>
 * Each name is {@value #PREFIX} followed by the TOML table and key in upper
 * snake case, for example {@code [join.hold] timeout} becomes
 * {@code LAZYMC_JOIN_HOLD_TIMEOUT}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvironmentKeys {

    public static final String PREFIX = "LAZYMC_";

    // [public]
    public static final String PUBLIC_ADDRESS = PREFIX + "PUBLIC_ADDRESS";
    public static final String PUBLIC_VERSION = PREFIX + "PUBLIC_VERSION";
    public static final String PUBLIC_PROTOCOL = PREFIX + "PUBLIC_PROTOCOL";

    // [server]
    public static final String SERVER_DIRECTORY = PREFIX + "SERVER_DIRECTORY";
    /** The only variable without a default. */
    public static final String SERVER_COMMAND = PREFIX + "SERVER_COMMAND";
    public static final String SERVER_ADDRESS = PREFIX + "SERVER_ADDRESS";
    public static final String SERVER_FREEZE_PROCESS = PREFIX + "SERVER_FREEZE_PROCESS";
    public static final String SERVER_WAKE_ON_START = PREFIX + "SERVER_WAKE_ON_START";
    public static final String SERVER_WAKE_ON_CRASH = PREFIX + "SERVER_WAKE_ON_CRASH";
    public static final String SERVER_PROBE_ON_START = PREFIX + "SERVER_PROBE_ON_START";
    public static final String SERVER_FORGE = PREFIX + "SERVER_FORGE";
    public static final String SERVER_START_TIMEOUT = PREFIX + "SERVER_START_TIMEOUT";
    public static final String SERVER_STOP_TIMEOUT = PREFIX + "SERVER_STOP_TIMEOUT";
    public static final String SERVER_WAKE_WHITELIST = PREFIX + "SERVER_WAKE_WHITELIST";
    public static final String SERVER_BLOCK_BANNED_IPS = PREFIX + "SERVER_BLOCK_BANNED_IPS";
    public static final String SERVER_DROP_BANNED_IPS = PREFIX + "SERVER_DROP_BANNED_IPS";
    public static final String SERVER_SEND_PROXY_V2 = PREFIX + "SERVER_SEND_PROXY_V2";

    // [time]
    public static final String TIME_SLEEP_AFTER = PREFIX + "TIME_SLEEP_AFTER";
    public static final String TIME_MIN_ONLINE_TIME = PREFIX + "TIME_MIN_ONLINE_TIME";

    // [motd]
    public static final String MOTD_SLEEPING = PREFIX + "MOTD_SLEEPING";
    public static final String MOTD_STARTING = PREFIX + "MOTD_STARTING";
    public static final String MOTD_STOPPING = PREFIX + "MOTD_STOPPING";
    public static final String MOTD_FROM_SERVER = PREFIX + "MOTD_FROM_SERVER";

    // [join]
    public static final String JOIN_METHODS = PREFIX + "JOIN_METHODS";
    public static final String JOIN_KICK_STARTING = PREFIX + "JOIN_KICK_STARTING";
    public static final String JOIN_KICK_STOPPING = PREFIX + "JOIN_KICK_STOPPING";
    public static final String JOIN_HOLD_TIMEOUT = PREFIX + "JOIN_HOLD_TIMEOUT";
    public static final String JOIN_FORWARD_ADDRESS = PREFIX + "JOIN_FORWARD_ADDRESS";
    public static final String JOIN_FORWARD_SEND_PROXY_V2 = PREFIX + "JOIN_FORWARD_SEND_PROXY_V2";
    public static final String JOIN_LOBBY_TIMEOUT = PREFIX + "JOIN_LOBBY_TIMEOUT";
    public static final String JOIN_LOBBY_MESSAGE = PREFIX + "JOIN_LOBBY_MESSAGE";
    public static final String JOIN_LOBBY_READY_SOUND = PREFIX + "JOIN_LOBBY_READY_SOUND";

    // [lockout]
    public static final String LOCKOUT_ENABLED = PREFIX + "LOCKOUT_ENABLED";
    public static final String LOCKOUT_MESSAGE = PREFIX + "LOCKOUT_MESSAGE";

    // [rcon]
    public static final String RCON_ENABLED = PREFIX + "RCON_ENABLED";
    public static final String RCON_PORT = PREFIX + "RCON_PORT";
    public static final String RCON_PASSWORD = PREFIX + "RCON_PASSWORD";
    public static final String RCON_RANDOMIZE_PASSWORD = PREFIX + "RCON_RANDOMIZE_PASSWORD";
    public static final String RCON_SEND_PROXY_V2 = PREFIX + "RCON_SEND_PROXY_V2";

    // [advanced]
    public static final String ADVANCED_REWRITE_SERVER_PROPERTIES = PREFIX + "ADVANCED_REWRITE_SERVER_PROPERTIES";

    // [config]
    public static final String CONFIG_VERSION = PREFIX + "CONFIG_VERSION";

    private EnvironmentKeys() {
        // constants
    }
}
