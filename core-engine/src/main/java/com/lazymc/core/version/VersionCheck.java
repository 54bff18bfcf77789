package com.lazymc.core.version;

import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the {@code [config] version} declared in a configuration file
 * against the oldest version whose field set is still current.
 *
 * <p>
 * None of the outcomes is fatal. The loader logs {@link Result#message()} for
 * every result except {@link Result#CURRENT}.
 * </p>
 *
 * @since 1.0.0
 */
public final class VersionCheck {

    /** Oldest configuration version that does not trigger a warning. */
    public static final String MINIMUM_VERSION = "0.2.8";

    private static final VersionCheck DEFAULT = new VersionCheck(ConfigVersion.of(MINIMUM_VERSION));

    /**
     * Outcome of a version check.
     */
    public enum Result {
        /** Declared version is at least the minimum. */
        CURRENT(null),
        /** No version declared. */
        UNKNOWN("Config version unknown, it may be outdated"),
        /** Declared version is older than the minimum. */
        OUTDATED("Config is for older lazymc version, you may need to update it"),
        /** Declared version could not be parsed. */
        INVALID("Config version is invalid, you may need to update it");

        private final String message;

        Result(String message) {
            this.message = message;
        }

        /**
         * @return warning text, or {@code null} for {@link #CURRENT}
         */
        public String message() {
            return message;
        }

        /**
         * @return {@code true} if this result should be reported as a warning
         */
        public boolean isWarning() {
            return this != CURRENT;
        }
    }

    private final ConfigVersion minimum;

    /**
     * @param minimum oldest accepted version; must not be {@code null}
     */
    public VersionCheck(ConfigVersion minimum) {
        this.minimum = Objects.requireNonNull(minimum, "Minimum version must not be null");
    }

    /**
     * @return checker against {@link #MINIMUM_VERSION}
     */
    public static VersionCheck defaultCheck() {
        return DEFAULT;
    }

    /**
     * Classify a declared version.
     *
     * @param declared declared version text, if any; must not be {@code null}
     * @return the classification
     */
    public Result check(Optional<String> declared) {
        Objects.requireNonNull(declared, "Declared version must not be null");
        if (declared.isEmpty()) {
            return Result.UNKNOWN;
        }
        return ConfigVersion.parse(declared.get())
                .map(version -> version.isAtLeast(minimum) ? Result.CURRENT : Result.OUTDATED)
                .orElse(Result.INVALID);
    }

    /**
     * @return the minimum version this checker compares against
     */
    public ConfigVersion getMinimum() {
        return minimum;
    }
}
