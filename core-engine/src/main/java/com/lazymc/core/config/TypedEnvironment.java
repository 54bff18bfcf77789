package com.lazymc.core.config;

import com.lazymc.core.net.SocketAddressResolver;

import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed accessors over an {@link EnvironmentSource}.
 *
 * <p>
 * Every accessor takes a default and never fails: a missing variable or a
 * value that does not parse as the requested type yields the default. Nothing
 * is logged when that happens. Text values are passed through
 * {@link EscapeDecoder}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TypedEnvironment {

    private static final long U16_MAX = 0xFFFFL;
    private static final long U32_MAX = 0xFFFF_FFFFL;

    private final EnvironmentSource source;
    private final SocketAddressResolver resolver;

    /**
     * @param source   raw variable lookup; must not be {@code null}
     * @param resolver resolver for address values; must not be {@code null}
     */
    public TypedEnvironment(EnvironmentSource source, SocketAddressResolver resolver) {
        this.source = Objects.requireNonNull(source, "EnvironmentSource must not be null");
        this.resolver = Objects.requireNonNull(resolver, "SocketAddressResolver must not be null");
    }

    /**
     * @param key variable name
     * @return the escape-decoded value, or empty if unset
     */
    public Optional<String> optionalString(String key) {
        return source.get(key).map(EscapeDecoder::decode);
    }

    public String string(String key, String defaultValue) {
        return optionalString(key).orElse(defaultValue);
    }

    /**
     * Boolean accessor. {@code true}, {@code 1}, {@code yes}, {@code on} and
     * {@code false}, {@code 0}, {@code no}, {@code off} are recognised in any
     * case.
     */
    public boolean bool(String key, boolean defaultValue) {
        return source.get(key)
                .map(value -> switch (value.toLowerCase(Locale.ROOT)) {
                    case "true", "1", "yes", "on" -> true;
                    case "false", "0", "no", "off" -> false;
                    default -> defaultValue;
                })
                .orElse(defaultValue);
    }

    public int u16(String key, int defaultValue) {
        return (int) unsigned(key, U16_MAX, defaultValue);
    }

    public long u32(String key, long defaultValue) {
        return unsigned(key, U32_MAX, defaultValue);
    }

    /**
     * Socket address accessor. Hostnames are resolved; a value that cannot be
     * parsed or resolved falls back to {@code defaultValue}.
     *
     * @param key          variable name
     * @param defaultValue literal {@code ip:port} default
     * @return resolved address
     */
    public InetSocketAddress socketAddress(String key, String defaultValue) {
        Optional<String> value = source.get(key);
        if (value.isEmpty()) {
            return SocketAddressResolver.literal(defaultValue);
        }
        try {
            return resolver.resolve(value.get());
        } catch (UnknownHostException | IllegalArgumentException e) {
            return SocketAddressResolver.literal(defaultValue);
        }
    }

    /**
     * Comma separated list accessor. Elements are trimmed; empty elements are
     * kept.
     */
    public List<String> stringList(String key, List<String> defaultValue) {
        Optional<String> value = source.get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        List<String> items = new ArrayList<>();
        for (String item : value.get().split(",", -1)) {
            items.add(item.trim());
        }
        return List.copyOf(items);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private long unsigned(String key, long max, long defaultValue) {
        Optional<String> value = source.get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.get());
            return (parsed < 0 || parsed > max) ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
