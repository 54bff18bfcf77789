package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the resolved configuration tree.
 *
 * <p>
 * Instances are fully populated and immutable. They are built once at startup
 * and shared read-only by every consumer, so no synchronisation is needed.
 * </p>
 *
 * <p>
 * A configuration loaded from a file remembers the file it came from. That
 * path is the base directory for {@link #serverDirectory()}; it cannot be
 * changed on an existing instance.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = Config.Builder.class)
public final class Config {

    private final Path path;
    private final PublicConfig publicConfig;
    private final ServerConfig server;
    private final TimeConfig time;
    private final MotdConfig motd;
    private final JoinConfig join;
    private final LockoutConfig lockout;
    private final RconConfig rcon;
    private final AdvancedConfig advanced;
    private final ConfigMeta meta;

    private Config(Builder b, Path path) {
        this.path = path;
        this.publicConfig = b.publicConfig;
        this.server = b.server;
        this.time = b.time;
        this.motd = b.motd;
        this.join = b.join;
        this.lockout = b.lockout;
        this.rcon = b.rcon;
        this.advanced = b.advanced;
        this.meta = b.meta;
    }

    private Config(Config source, Path path) {
        this.path = path;
        this.publicConfig = source.publicConfig;
        this.server = source.server;
        this.time = source.time;
        this.motd = source.motd;
        this.join = source.join;
        this.lockout = source.lockout;
        this.rcon = source.rcon;
        this.advanced = source.advanced;
        this.meta = source.meta;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this configuration that was loaded from {@code path}.
     *
     * @param path configuration file; must not be {@code null}
     * @return new configuration carrying the path
     */
    public Config withPath(Path path) {
        return new Config(this, Objects.requireNonNull(path, "Config path must not be null"));
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * Directory the backend server runs in.
     *
     * <p>
     * For a file-sourced configuration the declared directory is resolved
     * against the directory holding the file. Otherwise the declared directory
     * is returned unchanged. Existence is not checked.
     * </p>
     *
     * @return server directory
     */
    public Path serverDirectory() {
        Path declared = server.getDirectory();
        Path base = path != null ? path.getParent() : null;
        return base != null ? base.resolve(declared) : declared;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return configuration file this tree was loaded from, or empty when it
     *         was built from the environment
     */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    public PublicConfig getPublic() {
        return publicConfig;
    }

    public ServerConfig getServer() {
        return server;
    }

    public TimeConfig getTime() {
        return time;
    }

    public MotdConfig getMotd() {
        return motd;
    }

    public JoinConfig getJoin() {
        return join;
    }

    public LockoutConfig getLockout() {
        return lockout;
    }

    public RconConfig getRcon() {
        return rcon;
    }

    public AdvancedConfig getAdvanced() {
        return advanced;
    }

    /**
     * @return the {@code [config]} table
     */
    public ConfigMeta getMeta() {
        return meta;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Config that))
            return false;
        return Objects.equals(path, that.path)
                && Objects.equals(publicConfig, that.publicConfig)
                && Objects.equals(server, that.server)
                && Objects.equals(time, that.time)
                && Objects.equals(motd, that.motd)
                && Objects.equals(join, that.join)
                && Objects.equals(lockout, that.lockout)
                && Objects.equals(rcon, that.rcon)
                && Objects.equals(advanced, that.advanced)
                && Objects.equals(meta, that.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, publicConfig, server, time, motd, join, lockout, rcon, advanced, meta);
    }

    @Override
    public String toString() {
        return "Config{" +
                "path=" + path +
                ", public=" + publicConfig +
                ", server=" + server +
                ", time=" + time +
                ", motd=" + motd +
                ", join=" + join +
                ", lockout=" + lockout +
                ", rcon=" + rcon +
                ", advanced=" + advanced +
                ", config=" + meta +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link Config}. Every section except {@code server} starts
     * out with its defaults.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private PublicConfig publicConfig = PublicConfig.defaults();
        private ServerConfig server;
        private TimeConfig time = TimeConfig.defaults();
        private MotdConfig motd = MotdConfig.defaults();
        private JoinConfig join = JoinConfig.defaults();
        private LockoutConfig lockout = LockoutConfig.defaults();
        private RconConfig rcon = RconConfig.defaults();
        private AdvancedConfig advanced = AdvancedConfig.defaults();
        private ConfigMeta meta = ConfigMeta.defaults();

        @JsonProperty("public")
        public Builder publicConfig(PublicConfig v) {
            this.publicConfig = Objects.requireNonNull(v, "public");
            return this;
        }

        @JsonProperty("server")
        public Builder server(ServerConfig v) {
            this.server = Objects.requireNonNull(v, "server");
            return this;
        }

        @JsonProperty("time")
        public Builder time(TimeConfig v) {
            this.time = Objects.requireNonNull(v, "time");
            return this;
        }

        @JsonProperty("motd")
        public Builder motd(MotdConfig v) {
            this.motd = Objects.requireNonNull(v, "motd");
            return this;
        }

        @JsonProperty("join")
        public Builder join(JoinConfig v) {
            this.join = Objects.requireNonNull(v, "join");
            return this;
        }

        @JsonProperty("lockout")
        public Builder lockout(LockoutConfig v) {
            this.lockout = Objects.requireNonNull(v, "lockout");
            return this;
        }

        @JsonProperty("rcon")
        public Builder rcon(RconConfig v) {
            this.rcon = Objects.requireNonNull(v, "rcon");
            return this;
        }

        @JsonProperty("advanced")
        public Builder advanced(AdvancedConfig v) {
            this.advanced = Objects.requireNonNull(v, "advanced");
            return this;
        }

        @JsonProperty("config")
        public Builder meta(ConfigMeta v) {
            this.meta = Objects.requireNonNull(v, "config");
            return this;
        }

        /**
         * @return the configuration, without a source path
         * @throws IllegalStateException if no server section was set
         */
        public Config build() {
            if (server == null) {
                throw new IllegalStateException("missing table [server]");
            }
            return new Config(this, null);
        }
    }
}
