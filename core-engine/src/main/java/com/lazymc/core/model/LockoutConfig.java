package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * Lockout: when enabled, every connecting client is kicked immediately.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = LockoutConfig.Builder.class)
public final class LockoutConfig {

    public static final boolean DEFAULT_ENABLED = false;
    public static final String DEFAULT_MESSAGE = "Server is closed §7☠§r\n\nPlease come back another time.";

    private final boolean enabled;
    private final String message;

    private LockoutConfig(Builder b) {
        this.enabled = b.enabled;
        this.message = b.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LockoutConfig defaults() {
        return builder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LockoutConfig that))
            return false;
        return enabled == that.enabled && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, message);
    }

    @Override
    public String toString() {
        return "LockoutConfig{enabled=" + enabled + ", message='" + message + "'}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private boolean enabled = DEFAULT_ENABLED;
        private String message = DEFAULT_MESSAGE;

        @JsonProperty("enabled")
        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        @JsonProperty("message")
        public Builder message(String v) {
            this.message = Objects.requireNonNull(v, "message");
            return this;
        }

        public LockoutConfig build() {
            return new LockoutConfig(this);
        }
    }
}
