package com.lazymc.core.net;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns {@code host:port} text into a concrete, resolved
 * {@link InetSocketAddress}.
 *
 * <p>
 * Accepted forms are {@code 1.2.3.4:25565}, {@code [::1]:25565} and
 * {@code example.com:25565}. Literal addresses are converted without touching
 * the resolver. Hostnames go through the configured {@link HostLookup} and the
 * first returned address is used, so the result is deterministic for a given
 * resolver answer.
 * </p>
 *
 * <p>
 * Lookups block and have no timeout of their own.
 * </p>
 *
 * @since 1.0.0
 */
public final class SocketAddressResolver {

    private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

    /** Hosts made only of digits and dots are IPv4 literals, never hostnames. */
    private static final Pattern NUMERIC_HOST_PATTERN = Pattern.compile("\\A[\\d.]+\\z");

    private static final SocketAddressResolver SYSTEM = new SocketAddressResolver(HostLookup.SYSTEM);

    private static final SocketAddressResolver LITERAL_ONLY = new SocketAddressResolver(host -> {
        throw new UnknownHostException("Not a literal IP address: " + host);
    });

    private final HostLookup lookup;

    /**
     * @param lookup hostname lookup; must not be {@code null}
     */
    public SocketAddressResolver(HostLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "HostLookup must not be null");
    }

    /**
     * @return resolver backed by the system hostname lookup
     */
    public static SocketAddressResolver system() {
        return SYSTEM;
    }

    /**
     * Parse a socket address whose host is a literal IP address. Used for
     * built-in defaults, which never need a lookup.
     *
     * @param value literal {@code ip:port} text
     * @return the address
     * @throws IllegalArgumentException if the text is not a literal address
     */
    public static InetSocketAddress literal(String value) {
        try {
            return LITERAL_ONLY.resolve(value);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * Parse and resolve a socket address.
     *
     * @param value {@code host:port} text; must not be {@code null}
     * @return resolved address
     * @throws IllegalArgumentException if the text is not a valid
     *                                  {@code host:port} pair
     * @throws UnknownHostException     if the host cannot be resolved
     */
    public InetSocketAddress resolve(String value) throws UnknownHostException {
        Objects.requireNonNull(value, "Socket address must not be null");
        String text = value.trim();

        String host;
        String portPart;
        if (text.startsWith("[")) {
            int close = text.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("IPv6 address must be closed with ']': " + value);
            }
            if (close + 1 >= text.length() || text.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("Missing ':<port>' after IPv6 address: " + value);
            }
            host = text.substring(1, close);
            portPart = text.substring(close + 2);
            return new InetSocketAddress(parseIpv6(host, value), parsePort(portPart, value));
        }

        int colon = text.lastIndexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Socket address must use HOST:PORT format: " + value);
        }
        host = text.substring(0, colon);
        portPart = text.substring(colon + 1);
        if (host.indexOf(':') >= 0) {
            throw new IllegalArgumentException("IPv6 address must be wrapped in [ ]: " + value);
        }
        int port = parsePort(portPart, value);

        if (IPV4_PATTERN.matcher(host).matches()) {
            return new InetSocketAddress(parseIpv4(host, value), port);
        }
        if (NUMERIC_HOST_PATTERN.matcher(host).matches()) {
            throw new IllegalArgumentException("Invalid IPv4 address in: " + value);
        }
        return new InetSocketAddress(lookupFirst(host), port);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private InetAddress lookupFirst(String host) throws UnknownHostException {
        InetAddress[] addresses = lookup.lookup(host);
        if (addresses == null || addresses.length == 0) {
            throw new UnknownHostException("No addresses found for host: " + host);
        }
        return addresses[0];
    }

    private static InetAddress parseIpv4(String host, String original) throws UnknownHostException {
        String[] parts = host.split("\\.");
        byte[] octets = new byte[4];
        for (int i = 0; i < 4; i++) {
            if (parts[i].length() > 1 && parts[i].charAt(0) == '0') {
                throw new IllegalArgumentException("Leading zero in IPv4 octet " + parts[i] + " in: " + original);
            }
            int octet = Integer.parseInt(parts[i]);
            if (octet > 255) {
                throw new IllegalArgumentException("Invalid IPv4 octet " + octet + " in: " + original);
            }
            octets[i] = (byte) octet;
        }
        return InetAddress.getByAddress(host, octets);
    }

    private static InetAddress parseIpv6(String host, String original) {
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Empty IPv6 address in: " + original);
        }
        // literal IPv6 text never triggers a DNS query
        try {
            InetAddress address = InetAddress.getByName(host);
            if (!(address instanceof Inet6Address)) {
                throw new IllegalArgumentException("Invalid IPv6 address in: " + original);
            }
            return address;
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IPv6 address in: " + original, e);
        }
    }

    private static int parsePort(String portPart, String original) {
        int port;
        try {
            port = Integer.parseInt(portPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Port must be numeric in: " + original, e);
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Port must be in [0, 65535], got " + port + " in: " + original);
        }
        return port;
    }
}
