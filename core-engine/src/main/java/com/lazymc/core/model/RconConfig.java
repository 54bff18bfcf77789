package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Locale;
import java.util.Objects;

/**
 * Remote console access used to put the server to sleep where process
 * signals are not available.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = RconConfig.Builder.class)
public final class RconConfig {

    /** Enabled by default on Windows hosts only. */
    public static final boolean DEFAULT_ENABLED =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    public static final int DEFAULT_PORT = 25575;
    public static final String DEFAULT_PASSWORD = "";
    public static final boolean DEFAULT_RANDOMIZE_PASSWORD = true;
    public static final boolean DEFAULT_SEND_PROXY_V2 = false;

    private final boolean enabled;
    private final int port;
    private final String password;
    private final boolean randomizePassword;
    private final boolean sendProxyV2;

    private RconConfig(Builder b) {
        this.enabled = b.enabled;
        this.port = b.port;
        this.password = b.password;
        this.randomizePassword = b.randomizePassword;
        this.sendProxyV2 = b.sendProxyV2;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RconConfig defaults() {
        return builder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getPort() {
        return port;
    }

    public String getPassword() {
        return password;
    }

    /**
     * @return {@code true} to generate a new password on every server start
     */
    public boolean isRandomizePassword() {
        return randomizePassword;
    }

    public boolean isSendProxyV2() {
        return sendProxyV2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RconConfig that))
            return false;
        return enabled == that.enabled
                && port == that.port
                && randomizePassword == that.randomizePassword
                && sendProxyV2 == that.sendProxyV2
                && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, port, password, randomizePassword, sendProxyV2);
    }

    @Override
    public String toString() {
        return "RconConfig{" +
                "enabled=" + enabled +
                ", port=" + port +
                ", password=" + (password.isEmpty() ? "''" : "'***'") +
                ", randomizePassword=" + randomizePassword +
                ", sendProxyV2=" + sendProxyV2 +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private boolean enabled = DEFAULT_ENABLED;
        private int port = DEFAULT_PORT;
        private String password = DEFAULT_PASSWORD;
        private boolean randomizePassword = DEFAULT_RANDOMIZE_PASSWORD;
        private boolean sendProxyV2 = DEFAULT_SEND_PROXY_V2;

        @JsonProperty("enabled")
        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        @JsonProperty("port")
        public Builder port(long v) {
            this.port = Unsigned.requireU16("rcon.port", v);
            return this;
        }

        @JsonProperty("password")
        public Builder password(String v) {
            this.password = Objects.requireNonNull(v, "password");
            return this;
        }

        @JsonProperty("randomize_password")
        public Builder randomizePassword(boolean v) {
            this.randomizePassword = v;
            return this;
        }

        @JsonProperty("send_proxy_v2")
        public Builder sendProxyV2(boolean v) {
            this.sendProxyV2 = v;
            return this;
        }

        public RconConfig build() {
            return new RconConfig(this);
        }
    }
}
