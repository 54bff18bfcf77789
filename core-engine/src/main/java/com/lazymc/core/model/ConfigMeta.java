package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code [config]} table: metadata about the configuration itself.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = ConfigMeta.Builder.class)
public final class ConfigMeta {

    private final String version;

    private ConfigMeta(Builder b) {
        this.version = b.version;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConfigMeta defaults() {
        return builder().build();
    }

    /**
     * @return lazymc version the configuration was written for, if declared
     */
    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConfigMeta that))
            return false;
        return Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(version);
    }

    @Override
    public String toString() {
        return "ConfigMeta{version=" + version + '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String version;

        @JsonProperty("version")
        public Builder version(String v) {
            this.version = v;
            return this;
        }

        public ConfigMeta build() {
            return new ConfigMeta(this);
        }
    }
}
