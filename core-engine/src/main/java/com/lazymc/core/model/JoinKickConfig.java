package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * Messages for the {@link JoinMethod#KICK} join method.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = JoinKickConfig.Builder.class)
public final class JoinKickConfig {

    public static final String DEFAULT_STARTING =
            "Server is starting... §c♥§r\n\nThis may take some time.\n\nPlease try to reconnect in a minute.";
    public static final String DEFAULT_STOPPING =
            "Server is going to sleep... §7☠§r\n\nPlease try to reconnect in a minute to wake it again.";

    private final String starting;
    private final String stopping;

    private JoinKickConfig(Builder b) {
        this.starting = b.starting;
        this.stopping = b.stopping;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JoinKickConfig defaults() {
        return builder().build();
    }

    public String getStarting() {
        return starting;
    }

    public String getStopping() {
        return stopping;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinKickConfig that))
            return false;
        return Objects.equals(starting, that.starting) && Objects.equals(stopping, that.stopping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(starting, stopping);
    }

    @Override
    public String toString() {
        return "JoinKickConfig{starting='" + starting + "', stopping='" + stopping + "'}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String starting = DEFAULT_STARTING;
        private String stopping = DEFAULT_STOPPING;

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

        public JoinKickConfig build() {
            return new JoinKickConfig(this);
        }
    }
}
