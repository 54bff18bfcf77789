package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Advanced toggles.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AdvancedConfig.Builder.class)
public final class AdvancedConfig {

    public static final boolean DEFAULT_REWRITE_SERVER_PROPERTIES = true;

    private final boolean rewriteServerProperties;

    private AdvancedConfig(Builder b) {
        this.rewriteServerProperties = b.rewriteServerProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AdvancedConfig defaults() {
        return builder().build();
    }

    /**
     * @return {@code true} to let the proxy rewrite the backend's
     *         {@code server.properties}
     */
    public boolean isRewriteServerProperties() {
        return rewriteServerProperties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AdvancedConfig that))
            return false;
        return rewriteServerProperties == that.rewriteServerProperties;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(rewriteServerProperties);
    }

    @Override
    public String toString() {
        return "AdvancedConfig{rewriteServerProperties=" + rewriteServerProperties + '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private boolean rewriteServerProperties = DEFAULT_REWRITE_SERVER_PROPERTIES;

        @JsonProperty("rewrite_server_properties")
        public Builder rewriteServerProperties(boolean v) {
            this.rewriteServerProperties = v;
            return this;
        }

        public AdvancedConfig build() {
            return new AdvancedConfig(this);
        }
    }
}
