package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Settings for the {@link JoinMethod#HOLD} join method.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = JoinHoldConfig.Builder.class)
public final class JoinHoldConfig {

    /** Kept below the 30 second Minecraft client timeout. */
    public static final long DEFAULT_TIMEOUT = 25;

    private final long timeout;

    private JoinHoldConfig(Builder b) {
        this.timeout = b.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JoinHoldConfig defaults() {
        return builder().build();
    }

    /**
     * @return seconds to hold a joining client while the server starts
     */
    public long getTimeout() {
        return timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinHoldConfig that))
            return false;
        return timeout == that.timeout;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(timeout);
    }

    @Override
    public String toString() {
        return "JoinHoldConfig{timeout=" + timeout + '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private long timeout = DEFAULT_TIMEOUT;

        @JsonProperty("timeout")
        public Builder timeout(long v) {
            this.timeout = Unsigned.requireU32("join.hold.timeout", v);
            return this;
        }

        public JoinHoldConfig build() {
            return new JoinHoldConfig(this);
        }
    }
}
