package com.lazymc.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Fatal configuration error. No partial configuration is ever returned
 * alongside it; the caller is expected to report the message and hints and
 * stop the process.
 *
 * @since 1.0.0
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<ErrorHint> hints;

    public ConfigLoadException(String message, List<ErrorHint> hints) {
        this(message, null, hints);
    }

    public ConfigLoadException(String message, Throwable cause, List<ErrorHint> hints) {
        super(message, cause);
        this.hints = List.copyOf(Objects.requireNonNull(hints, "hints"));
    }

    /**
     * @return hints to show with the error, in display order
     */
    public List<ErrorHint> getHints() {
        return hints;
    }
}
