package com.lazymc.core.config;

import com.lazymc.core.model.AdvancedConfig;
import com.lazymc.core.model.Config;
import com.lazymc.core.model.ConfigMeta;
import com.lazymc.core.model.JoinConfig;
import com.lazymc.core.model.JoinForwardConfig;
import com.lazymc.core.model.JoinHoldConfig;
import com.lazymc.core.model.JoinKickConfig;
import com.lazymc.core.model.JoinLobbyConfig;
import com.lazymc.core.model.JoinMethod;
import com.lazymc.core.model.LockoutConfig;
import com.lazymc.core.model.MotdConfig;
import com.lazymc.core.model.PublicConfig;
import com.lazymc.core.model.RconConfig;
import com.lazymc.core.model.ServerConfig;
import com.lazymc.core.model.TimeConfig;
import com.lazymc.core.net.SocketAddressResolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.lazymc.core.config.EnvironmentKeys.*;

/**
 * Builds a {@link Config} from {@link EnvironmentKeys environment variables}.
 *
 * <p>
 * Apart from {@link EnvironmentKeys#SERVER_COMMAND}, every variable is
 * optional and falls back to the section default when absent or malformed.
 * Unknown join methods in {@link EnvironmentKeys#JOIN_METHODS} are dropped.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvironmentConfigDecoder {

    private final TypedEnvironment env;

    /**
     * @param source   variable lookup; must not be {@code null}
     * @param resolver resolver for address variables; must not be {@code null}
     */
    public EnvironmentConfigDecoder(EnvironmentSource source, SocketAddressResolver resolver) {
        this.env = new TypedEnvironment(source, resolver);
    }

    /**
     * @param source variable lookup; must not be {@code null}
     */
    public EnvironmentConfigDecoder(EnvironmentSource source) {
        this(source, SocketAddressResolver.system());
    }

    /**
     * Decode the full configuration tree.
     *
     * @return configuration without a source path
     * @throws ConfigLoadException if {@link EnvironmentKeys#SERVER_COMMAND}
     *                             is unset or empty
     */
    public Config decode() {
        String command = env.optionalString(SERVER_COMMAND)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new ConfigLoadException(
                        "Missing required environment variable: " + SERVER_COMMAND,
                        List.of(ErrorHint.SERVER_COMMAND_ENV, ErrorHint.CONFIG_PATH)));

        return Config.builder()
                .publicConfig(decodePublic())
                .server(decodeServer(command))
                .time(decodeTime())
                .motd(decodeMotd())
                .join(decodeJoin())
                .lockout(decodeLockout())
                .rcon(decodeRcon())
                .advanced(decodeAdvanced())
                .meta(decodeMeta())
                .build();
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    PublicConfig decodePublic() {
        return PublicConfig.builder()
                .address(env.socketAddress(PUBLIC_ADDRESS, PublicConfig.DEFAULT_ADDRESS))
                .version(env.string(PUBLIC_VERSION, PublicConfig.DEFAULT_VERSION))
                .protocol(env.u32(PUBLIC_PROTOCOL, PublicConfig.DEFAULT_PROTOCOL))
                .build();
    }

    ServerConfig decodeServer(String command) {
        Objects.requireNonNull(command, "command");
        return ServerConfig.builder()
                .directory(env.string(SERVER_DIRECTORY, ServerConfig.DEFAULT_DIRECTORY))
                .command(command)
                .address(env.socketAddress(SERVER_ADDRESS, ServerConfig.DEFAULT_ADDRESS))
                .freezeProcess(env.bool(SERVER_FREEZE_PROCESS, ServerConfig.DEFAULT_FREEZE_PROCESS))
                .wakeOnStart(env.bool(SERVER_WAKE_ON_START, ServerConfig.DEFAULT_WAKE_ON_START))
                .wakeOnCrash(env.bool(SERVER_WAKE_ON_CRASH, ServerConfig.DEFAULT_WAKE_ON_CRASH))
                .probeOnStart(env.bool(SERVER_PROBE_ON_START, ServerConfig.DEFAULT_PROBE_ON_START))
                .forge(env.bool(SERVER_FORGE, ServerConfig.DEFAULT_FORGE))
                .startTimeout(env.u32(SERVER_START_TIMEOUT, ServerConfig.DEFAULT_START_TIMEOUT))
                .stopTimeout(env.u32(SERVER_STOP_TIMEOUT, ServerConfig.DEFAULT_STOP_TIMEOUT))
                .wakeWhitelist(env.bool(SERVER_WAKE_WHITELIST, ServerConfig.DEFAULT_WAKE_WHITELIST))
                .blockBannedIps(env.bool(SERVER_BLOCK_BANNED_IPS, ServerConfig.DEFAULT_BLOCK_BANNED_IPS))
                .dropBannedIps(env.bool(SERVER_DROP_BANNED_IPS, ServerConfig.DEFAULT_DROP_BANNED_IPS))
                .sendProxyV2(env.bool(SERVER_SEND_PROXY_V2, ServerConfig.DEFAULT_SEND_PROXY_V2))
                .build();
    }

    TimeConfig decodeTime() {
        return TimeConfig.builder()
                .sleepAfter(env.u32(TIME_SLEEP_AFTER, TimeConfig.DEFAULT_SLEEP_AFTER))
                .minOnlineTime(env.u32(TIME_MIN_ONLINE_TIME, TimeConfig.DEFAULT_MIN_ONLINE_TIME))
                .build();
    }

    MotdConfig decodeMotd() {
        return MotdConfig.builder()
                .sleeping(env.string(MOTD_SLEEPING, MotdConfig.DEFAULT_SLEEPING))
                .starting(env.string(MOTD_STARTING, MotdConfig.DEFAULT_STARTING))
                .stopping(env.string(MOTD_STOPPING, MotdConfig.DEFAULT_STOPPING))
                .fromServer(env.bool(MOTD_FROM_SERVER, MotdConfig.DEFAULT_FROM_SERVER))
                .build();
    }

    JoinConfig decodeJoin() {
        List<String> defaultIds = JoinConfig.DEFAULT_METHODS.stream().map(JoinMethod::id).toList();
        List<JoinMethod> methods = env.stringList(JOIN_METHODS, defaultIds).stream()
                .map(JoinMethod::fromId)
                .flatMap(Optional::stream)
                .toList();

        return JoinConfig.builder()
                .methods(methods)
                .kick(JoinKickConfig.builder()
                        .starting(env.string(JOIN_KICK_STARTING, JoinKickConfig.DEFAULT_STARTING))
                        .stopping(env.string(JOIN_KICK_STOPPING, JoinKickConfig.DEFAULT_STOPPING))
                        .build())
                .hold(JoinHoldConfig.builder()
                        .timeout(env.u32(JOIN_HOLD_TIMEOUT, JoinHoldConfig.DEFAULT_TIMEOUT))
                        .build())
                .forward(JoinForwardConfig.builder()
                        .address(env.socketAddress(JOIN_FORWARD_ADDRESS, JoinForwardConfig.DEFAULT_ADDRESS))
                        .sendProxyV2(env.bool(JOIN_FORWARD_SEND_PROXY_V2, JoinForwardConfig.DEFAULT_SEND_PROXY_V2))
                        .build())
                .lobby(JoinLobbyConfig.builder()
                        .timeout(env.u32(JOIN_LOBBY_TIMEOUT, JoinLobbyConfig.DEFAULT_TIMEOUT))
                        .message(env.string(JOIN_LOBBY_MESSAGE, JoinLobbyConfig.DEFAULT_MESSAGE))
                        .readySound(env.string(JOIN_LOBBY_READY_SOUND, JoinLobbyConfig.DEFAULT_READY_SOUND))
                        .build())
                .build();
    }

    LockoutConfig decodeLockout() {
        return LockoutConfig.builder()
                .enabled(env.bool(LOCKOUT_ENABLED, LockoutConfig.DEFAULT_ENABLED))
                .message(env.string(LOCKOUT_MESSAGE, LockoutConfig.DEFAULT_MESSAGE))
                .build();
    }

    RconConfig decodeRcon() {
        return RconConfig.builder()
                .enabled(env.bool(RCON_ENABLED, RconConfig.DEFAULT_ENABLED))
                .port(env.u16(RCON_PORT, RconConfig.DEFAULT_PORT))
                .password(env.string(RCON_PASSWORD, RconConfig.DEFAULT_PASSWORD))
                .randomizePassword(env.bool(RCON_RANDOMIZE_PASSWORD, RconConfig.DEFAULT_RANDOMIZE_PASSWORD))
                .sendProxyV2(env.bool(RCON_SEND_PROXY_V2, RconConfig.DEFAULT_SEND_PROXY_V2))
                .build();
    }

    AdvancedConfig decodeAdvanced() {
        return AdvancedConfig.builder()
                .rewriteServerProperties(env.bool(ADVANCED_REWRITE_SERVER_PROPERTIES,
                        AdvancedConfig.DEFAULT_REWRITE_SERVER_PROPERTIES))
                .build();
    }

    ConfigMeta decodeMeta() {
        return ConfigMeta.builder()
                .version(env.optionalString(CONFIG_VERSION).orElse(null))
                .build();
    }
}
