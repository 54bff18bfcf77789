package com.lazymc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Ways to occupy a client that joins while the backend server is not ready.
 * Methods are tried in the configured order.
 *
 * @since 1.0.0
 */
public enum JoinMethod {

    /** Kick the client with a message. */
    KICK,

    /** Hold the connection until the server is ready. */
    HOLD,

    /** Forward the connection to another address. */
    FORWARD,

    /** Keep the client in a temporary lobby until the server is ready. */
    LOBBY;

    /**
     * @return lowercase identifier used in files and environment variables
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Look up a method by identifier, ignoring case.
     *
     * @param value identifier such as {@code hold}; may be {@code null}
     * @return the method, or empty if the identifier is unknown
     */
    public static Optional<JoinMethod> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (JoinMethod method : values()) {
            if (method.id().equals(normalized)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
