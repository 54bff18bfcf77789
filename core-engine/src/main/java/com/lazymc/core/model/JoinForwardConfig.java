package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.lazymc.core.net.SocketAddressDeserializer;
import com.lazymc.core.net.SocketAddressResolver;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Settings for the {@link JoinMethod#FORWARD} join method.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = JoinForwardConfig.Builder.class)
public final class JoinForwardConfig {

    public static final String DEFAULT_ADDRESS = "127.0.0.1:25565";
    public static final boolean DEFAULT_SEND_PROXY_V2 = false;

    private final InetSocketAddress address;
    private final boolean sendProxyV2;

    private JoinForwardConfig(Builder b) {
        this.address = b.address;
        this.sendProxyV2 = b.sendProxyV2;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static JoinForwardConfig defaults() {
        return builder().build();
    }

    /**
     * @return address joining clients are forwarded to
     */
    public InetSocketAddress getAddress() {
        return address;
    }

    /**
     * @return {@code true} to prepend a HAProxy v2 header to forwarded
     *         connections
     */
    public boolean isSendProxyV2() {
        return sendProxyV2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JoinForwardConfig that))
            return false;
        return sendProxyV2 == that.sendProxyV2 && Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, sendProxyV2);
    }

    @Override
    public String toString() {
        return "JoinForwardConfig{address=" + address + ", sendProxyV2=" + sendProxyV2 + '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private InetSocketAddress address = SocketAddressResolver.literal(DEFAULT_ADDRESS);
        private boolean sendProxyV2 = DEFAULT_SEND_PROXY_V2;

        @JsonProperty("address")
        @JsonDeserialize(using = SocketAddressDeserializer.class)
        public Builder address(InetSocketAddress v) {
            this.address = Objects.requireNonNull(v, "address");
            return this;
        }

        @JsonProperty("send_proxy_v2")
        public Builder sendProxyV2(boolean v) {
            this.sendProxyV2 = v;
            return this;
        }

        public JoinForwardConfig build() {
            return new JoinForwardConfig(this);
        }
    }
}
