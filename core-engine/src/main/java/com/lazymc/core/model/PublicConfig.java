package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.lazymc.core.net.SocketAddressDeserializer;
import com.lazymc.core.net.SocketAddressResolver;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Public-facing settings: the address the proxy listens on and the protocol
 * hints shown to clients until the real server version is known.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = PublicConfig.Builder.class)
public final class PublicConfig {

    public static final String DEFAULT_ADDRESS = "0.0.0.0:25565";
    public static final String DEFAULT_VERSION = "1.20.3";
    public static final long DEFAULT_PROTOCOL = 765;

    private final InetSocketAddress address;
    private final String version;
    private final long protocol;

    private PublicConfig(Builder b) {
        this.address = b.address;
        this.version = b.version;
        this.protocol = b.protocol;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PublicConfig defaults() {
        return builder().build();
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    /**
     * @return Minecraft version name hint
     */
    public String getVersion() {
        return version;
    }

    /**
     * @return Minecraft protocol number hint
     */
    public long getProtocol() {
        return protocol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PublicConfig that))
            return false;
        return protocol == that.protocol
                && Objects.equals(address, that.address)
                && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, version, protocol);
    }

    @Override
    public String toString() {
        return "PublicConfig{" +
                "address=" + address +
                ", version='" + version + '\'' +
                ", protocol=" + protocol +
                '}';
    }

    /**
     * Builder for {@link PublicConfig}; starts out with the defaults.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private InetSocketAddress address = SocketAddressResolver.literal(DEFAULT_ADDRESS);
        private String version = DEFAULT_VERSION;
        private long protocol = DEFAULT_PROTOCOL;

        @JsonProperty("address")
        @JsonDeserialize(using = SocketAddressDeserializer.class)
        public Builder address(InetSocketAddress v) {
            this.address = Objects.requireNonNull(v, "address");
            return this;
        }

        @JsonProperty("version")
        public Builder version(String v) {
            this.version = Objects.requireNonNull(v, "version");
            return this;
        }

        @JsonProperty("protocol")
        public Builder protocol(long v) {
            this.protocol = Unsigned.requireU32("public.protocol", v);
            return this;
        }

        public PublicConfig build() {
            return new PublicConfig(this);
        }
    }
}
