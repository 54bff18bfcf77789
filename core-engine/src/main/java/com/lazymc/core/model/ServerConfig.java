package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.lazymc.core.net.SocketAddressDeserializer;
import com.lazymc.core.net.SocketAddressResolver;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Backend server settings: where the server lives, how it is started, and
 * how the proxy treats the process and its connections.
 *
 * <p>
 * {@code command} is the only value of the whole configuration without a
 * default. {@link Builder#build()} rejects a builder that never received one.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = ServerConfig.Builder.class)
public final class ServerConfig {

    public static final String DEFAULT_DIRECTORY = ".";
    public static final String DEFAULT_ADDRESS = "127.0.0.1:25566";
    public static final boolean DEFAULT_FREEZE_PROCESS = true;
    public static final boolean DEFAULT_WAKE_ON_START = false;
    public static final boolean DEFAULT_WAKE_ON_CRASH = false;
    public static final boolean DEFAULT_PROBE_ON_START = false;
    public static final boolean DEFAULT_FORGE = false;
    public static final long DEFAULT_START_TIMEOUT = 300;
    public static final long DEFAULT_STOP_TIMEOUT = 150;
    public static final boolean DEFAULT_WAKE_WHITELIST = true;
    public static final boolean DEFAULT_BLOCK_BANNED_IPS = true;
    public static final boolean DEFAULT_DROP_BANNED_IPS = false;
    public static final boolean DEFAULT_SEND_PROXY_V2 = false;

    private final Path directory;
    private final String command;
    private final InetSocketAddress address;
    private final boolean freezeProcess;
    private final boolean wakeOnStart;
    private final boolean wakeOnCrash;
    private final boolean probeOnStart;
    private final boolean forge;
    private final long startTimeout;
    private final long stopTimeout;
    private final boolean wakeWhitelist;
    private final boolean blockBannedIps;
    private final boolean dropBannedIps;
    private final boolean sendProxyV2;

    private ServerConfig(Builder b) {
        this.directory = b.directory;
        this.command = b.command;
        this.address = b.address;
        this.freezeProcess = b.freezeProcess;
        this.wakeOnStart = b.wakeOnStart;
        this.wakeOnCrash = b.wakeOnCrash;
        this.probeOnStart = b.probeOnStart;
        this.forge = b.forge;
        this.startTimeout = b.startTimeout;
        this.stopTimeout = b.stopTimeout;
        this.wakeWhitelist = b.wakeWhitelist;
        this.blockBannedIps = b.blockBannedIps;
        this.dropBannedIps = b.dropBannedIps;
        this.sendProxyV2 = b.sendProxyV2;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * Server directory exactly as declared, not yet made relative to the
     * configuration file. Use {@link Config#serverDirectory()} to get the
     * directory the server process should run in.
     *
     * @return declared directory
     */
    public Path getDirectory() {
        return directory;
    }

    public String getCommand() {
        return command;
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    /**
     * @return {@code true} to freeze the process instead of stopping it when
     *         idle; only honoured on Unix hosts
     */
    public boolean isFreezeProcess() {
        return freezeProcess;
    }

    public boolean isWakeOnStart() {
        return wakeOnStart;
    }

    public boolean isWakeOnCrash() {
        return wakeOnCrash;
    }

    public boolean isProbeOnStart() {
        return probeOnStart;
    }

    public boolean isForge() {
        return forge;
    }

    /**
     * @return seconds to wait for the server to start before force killing it
     */
    public long getStartTimeout() {
        return startTimeout;
    }

    /**
     * @return seconds to wait for the server to stop before force killing it
     */
    public long getStopTimeout() {
        return stopTimeout;
    }

    public boolean isWakeWhitelist() {
        return wakeWhitelist;
    }

    public boolean isBlockBannedIps() {
        return blockBannedIps;
    }

    public boolean isDropBannedIps() {
        return dropBannedIps;
    }

    public boolean isSendProxyV2() {
        return sendProxyV2;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ServerConfig that))
            return false;
        return freezeProcess == that.freezeProcess
                && wakeOnStart == that.wakeOnStart
                && wakeOnCrash == that.wakeOnCrash
                && probeOnStart == that.probeOnStart
                && forge == that.forge
                && startTimeout == that.startTimeout
                && stopTimeout == that.stopTimeout
                && wakeWhitelist == that.wakeWhitelist
                && blockBannedIps == that.blockBannedIps
                && dropBannedIps == that.dropBannedIps
                && sendProxyV2 == that.sendProxyV2
                && Objects.equals(directory, that.directory)
                && Objects.equals(command, that.command)
                && Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(directory, command, address, freezeProcess, wakeOnStart, wakeOnCrash,
                probeOnStart, forge, startTimeout, stopTimeout, wakeWhitelist, blockBannedIps,
                dropBannedIps, sendProxyV2);
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "directory=" + directory +
                ", command='" + command + '\'' +
                ", address=" + address +
                ", freezeProcess=" + freezeProcess +
                ", wakeOnStart=" + wakeOnStart +
                ", wakeOnCrash=" + wakeOnCrash +
                ", probeOnStart=" + probeOnStart +
                ", forge=" + forge +
                ", startTimeout=" + startTimeout +
                ", stopTimeout=" + stopTimeout +
                ", wakeWhitelist=" + wakeWhitelist +
                ", blockBannedIps=" + blockBannedIps +
                ", dropBannedIps=" + dropBannedIps +
                ", sendProxyV2=" + sendProxyV2 +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link ServerConfig}; starts out with every default except
     * the command.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private Path directory = Path.of(DEFAULT_DIRECTORY);
        private String command;
        private InetSocketAddress address = SocketAddressResolver.literal(DEFAULT_ADDRESS);
        private boolean freezeProcess = DEFAULT_FREEZE_PROCESS;
        private boolean wakeOnStart = DEFAULT_WAKE_ON_START;
        private boolean wakeOnCrash = DEFAULT_WAKE_ON_CRASH;
        private boolean probeOnStart = DEFAULT_PROBE_ON_START;
        private boolean forge = DEFAULT_FORGE;
        private long startTimeout = DEFAULT_START_TIMEOUT;
        private long stopTimeout = DEFAULT_STOP_TIMEOUT;
        private boolean wakeWhitelist = DEFAULT_WAKE_WHITELIST;
        private boolean blockBannedIps = DEFAULT_BLOCK_BANNED_IPS;
        private boolean dropBannedIps = DEFAULT_DROP_BANNED_IPS;
        private boolean sendProxyV2 = DEFAULT_SEND_PROXY_V2;

        @JsonProperty("directory")
        public Builder directory(String v) {
            this.directory = Path.of(Objects.requireNonNull(v, "directory"));
            return this;
        }

        @JsonProperty("command")
        public Builder command(String v) {
            this.command = Objects.requireNonNull(v, "command");
            return this;
        }

        @JsonProperty("address")
        @JsonDeserialize(using = SocketAddressDeserializer.class)
        public Builder address(InetSocketAddress v) {
            this.address = Objects.requireNonNull(v, "address");
            return this;
        }

        @JsonProperty("freeze_process")
        public Builder freezeProcess(boolean v) {
            this.freezeProcess = v;
            return this;
        }

        @JsonProperty("wake_on_start")
        public Builder wakeOnStart(boolean v) {
            this.wakeOnStart = v;
            return this;
        }

        @JsonProperty("wake_on_crash")
        public Builder wakeOnCrash(boolean v) {
            this.wakeOnCrash = v;
            return this;
        }

        @JsonProperty("probe_on_start")
        public Builder probeOnStart(boolean v) {
            this.probeOnStart = v;
            return this;
        }

        @JsonProperty("forge")
        public Builder forge(boolean v) {
            this.forge = v;
            return this;
        }

        @JsonProperty("start_timeout")
        public Builder startTimeout(long v) {
            this.startTimeout = Unsigned.requireU32("server.start_timeout", v);
            return this;
        }

        @JsonProperty("stop_timeout")
        public Builder stopTimeout(long v) {
            this.stopTimeout = Unsigned.requireU32("server.stop_timeout", v);
            return this;
        }

        @JsonProperty("wake_whitelist")
        public Builder wakeWhitelist(boolean v) {
            this.wakeWhitelist = v;
            return this;
        }

        @JsonProperty("block_banned_ips")
        public Builder blockBannedIps(boolean v) {
            this.blockBannedIps = v;
            return this;
        }

        @JsonProperty("drop_banned_ips")
        public Builder dropBannedIps(boolean v) {
            this.dropBannedIps = v;
            return this;
        }

        @JsonProperty("send_proxy_v2")
        public Builder sendProxyV2(boolean v) {
            this.sendProxyV2 = v;
            return this;
        }

        /**
         * @return the server configuration
         * @throws IllegalStateException if no command was set
         */
        public ServerConfig build() {
            if (command == null) {
                throw new IllegalStateException("missing field 'command' in [server]");
            }
            return new ServerConfig(this);
        }
    }
}
