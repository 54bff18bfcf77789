package com.lazymc.core.net;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SocketAddressResolver}.
 */
class SocketAddressResolverTest {

    @Test
    @DisplayName("Should parse the default backend address exactly")
    void shouldParseLiteralIpv4() throws Exception {
        InetSocketAddress address = SocketAddressResolver.system().resolve("127.0.0.1:25566");

        assertThat(address.isUnresolved()).isFalse();
        assertThat(address.getAddress().getHostAddress()).isEqualTo("127.0.0.1");
        assertThat(address.getPort()).isEqualTo(25566);
    }

    @Test
    @DisplayName("Should not consult the hostname lookup for literal addresses")
    void shouldNotLookupLiterals() throws Exception {
        AtomicInteger lookups = new AtomicInteger();
        SocketAddressResolver resolver = new SocketAddressResolver(host -> {
            lookups.incrementAndGet();
            throw new UnknownHostException(host);
        });

        resolver.resolve("0.0.0.0:25565");
        resolver.resolve("[::1]:25565");

        assertThat(lookups).hasValue(0);
    }

    @Test
    @DisplayName("Should parse bracketed IPv6 addresses")
    void shouldParseIpv6() throws Exception {
        InetSocketAddress address = SocketAddressResolver.system().resolve("[::1]:19132");

        assertThat(address.getAddress()).isInstanceOf(Inet6Address.class);
        assertThat(address.getAddress().isLoopbackAddress()).isTrue();
        assertThat(address.getPort()).isEqualTo(19132);
    }

    @Test
    @DisplayName("Should pick the first address returned for a hostname")
    void shouldPickFirstLookupResult() throws Exception {
        InetAddress first = InetAddress.getByAddress("mc.example", new byte[] {10, 0, 0, 7});
        InetAddress second = InetAddress.getByAddress("mc.example", new byte[] {10, 0, 0, 8});
        SocketAddressResolver resolver = new SocketAddressResolver(host -> new InetAddress[] {first, second});

        InetSocketAddress address = resolver.resolve("mc.example:25565");

        assertThat(address.getAddress()).isEqualTo(first);
        assertThat(address.getPort()).isEqualTo(25565);
    }

    @Test
    @DisplayName("Should resolve localhost through the system resolver")
    void shouldResolveLocalhost() throws Exception {
        InetSocketAddress address = SocketAddressResolver.system().resolve("localhost:25565");

        assertThat(address.isUnresolved()).isFalse();
        assertThat(address.getAddress().isLoopbackAddress()).isTrue();
        assertThat(address.getPort()).isEqualTo(25565);
    }

    @Test
    @DisplayName("Should propagate lookup failures")
    void shouldPropagateLookupFailure() {
        SocketAddressResolver resolver = new SocketAddressResolver(host -> {
            throw new UnknownHostException(host);
        });

        assertThatThrownBy(() -> resolver.resolve("nowhere.invalid:25565"))
                .isInstanceOf(UnknownHostException.class);
    }

    @Test
    @DisplayName("Should reject malformed address text")
    void shouldRejectMalformedText() {
        SocketAddressResolver resolver = SocketAddressResolver.system();

        assertThatThrownBy(() -> resolver.resolve("127.0.0.1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HOST:PORT");
        assertThatThrownBy(() -> resolver.resolve("127.0.0.1:port"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric");
        assertThatThrownBy(() -> resolver.resolve("127.0.0.1:70000"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve("300.0.0.1:25565"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("octet");
        assertThatThrownBy(() -> resolver.resolve("::1:25565"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[ ]");
        assertThatThrownBy(() -> resolver.resolve("[::1]25565"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"1.2.3:25565", "1.2.3.4.5:25565", "127.1:25565", "2130706433:25565",
            "010.0.0.1:25565", "127.0.0.01:25565", "1..2.3:25565"})
    @DisplayName("Should reject non-canonical IPv4 text without a hostname lookup")
    void shouldRejectNonCanonicalIpv4(String text) {
        SocketAddressResolver resolver = new SocketAddressResolver(host -> {
            throw new AssertionError("unexpected lookup of " + host);
        });

        assertThatThrownBy(() -> resolver.resolve(text))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("IPv4");
    }

    @Test
    @DisplayName("Literal parsing should refuse hostnames")
    void literalShouldRefuseHostnames() {
        assertThat(SocketAddressResolver.literal("0.0.0.0:25565").getPort()).isEqualTo(25565);
        assertThatThrownBy(() -> SocketAddressResolver.literal("localhost:25565"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("literal");
    }
}
