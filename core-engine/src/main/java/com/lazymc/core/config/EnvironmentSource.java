package com.lazymc.core.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Key/value lookup the environment decoder reads from.
 *
 * <p>
 * Production code uses {@link #system()}. Tests and embedders pass a map via
 * {@link #of(Map)} so the process environment is never touched.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnvironmentSource {

    /**
     * @param key variable name
     * @return the raw value, or empty if the variable is not set
     */
    Optional<String> get(String key);

    /**
     * @return source backed by {@link System#getenv(String)}
     */
    static EnvironmentSource system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    /**
     * @param variables variables to expose; copied
     * @return source backed by the given map
     */
    static EnvironmentSource of(Map<String, String> variables) {
        Map<String, String> copy = Map.copyOf(Objects.requireNonNull(variables, "variables"));
        return key -> Optional.ofNullable(copy.get(key));
    }
}
