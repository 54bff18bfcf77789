package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * Server list MOTD for each proxy state.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = MotdConfig.Builder.class)
public final class MotdConfig {

    public static final String DEFAULT_SLEEPING = "☠ Server is sleeping\n§2☻ Join to start it up";
    public static final String DEFAULT_STARTING = "§2☻ Server is starting...\n§7⌛ Please wait...";
    public static final String DEFAULT_STOPPING = "☠ Server going to sleep...\n⌛ Please wait...";
    public static final boolean DEFAULT_FROM_SERVER = false;

    private final String sleeping;
    private final String starting;
    private final String stopping;
    private final boolean fromServer;

    private MotdConfig(Builder b) {
        this.sleeping = b.sleeping;
        this.starting = b.starting;
        this.stopping = b.stopping;
        this.fromServer = b.fromServer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MotdConfig defaults() {
        return builder().build();
    }

    public String getSleeping() {
        return sleeping;
    }

    public String getStarting() {
        return starting;
    }

    public String getStopping() {
        return stopping;
    }

    /**
     * @return {@code true} to show the backend's own MOTD once it is known
     */
    public boolean isFromServer() {
        return fromServer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MotdConfig that))
            return false;
        return fromServer == that.fromServer
                && Objects.equals(sleeping, that.sleeping)
                && Objects.equals(starting, that.starting)
                && Objects.equals(stopping, that.stopping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sleeping, starting, stopping, fromServer);
    }

    @Override
    public String toString() {
        return "MotdConfig{" +
                "sleeping='" + sleeping + '\'' +
                ", starting='" + starting + '\'' +
                ", stopping='" + stopping + '\'' +
                ", fromServer=" + fromServer +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String sleeping = DEFAULT_SLEEPING;
        private String starting = DEFAULT_STARTING;
        private String stopping = DEFAULT_STOPPING;
        private boolean fromServer = DEFAULT_FROM_SERVER;

        @JsonProperty("sleeping")
        public Builder sleeping(String v) {
            this.sleeping = Objects.requireNonNull(v, "sleeping");
            return this;
        }

        @JsonProperty("starting")
        public Builder starting(String v) {
            this.starting = Objects.requireNonNull(v, "starting");
            return this;
        }

        @JsonProperty("stopping")
        public Builder stopping(String v) {
            this.stopping = Objects.requireNonNull(v, "stopping");
            return this;
        }

        @JsonProperty("from_server")
        public Builder fromServer(boolean v) {
            this.fromServer = v;
            return this;
        }

        public MotdConfig build() {
            return new MotdConfig(this);
        }
    }
}
