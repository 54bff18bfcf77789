package com.lazymc.core.net;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Hostname lookup used by {@link SocketAddressResolver} for hosts that are
 * not literal IP addresses.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface HostLookup {

    /** Lookup backed by the system resolver. */
    HostLookup SYSTEM = InetAddress::getAllByName;

    /**
     * Resolve a hostname.
     *
     * @param host hostname, never a literal IP address
     * @return resolved addresses in resolver order; never empty
     * @throws UnknownHostException if the name cannot be resolved
     */
    InetAddress[] lookup(String host) throws UnknownHostException;
}
