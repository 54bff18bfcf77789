package com.lazymc.launcher;

import com.lazymc.core.config.ConfigLoadException;
import com.lazymc.core.config.ErrorHint;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints a fatal configuration error with its cause chain and remediation
 * hints.
 *
 * <pre>
 * Error: Failed to load config: invalid config file /srv/lazymc.toml
 * Caused by: Unexpected character ...
 *
 * Hint: Pass the path of a different configuration file as the first argument
 * Hint: Validate the configuration file: ...
 * </pre>
 *
 * @since 1.0.0
 */
public class FatalErrorReporter {

    /** Process exit code used for every fatal configuration error. */
    public static final int EXIT_CODE = 1;

    private final PrintStream out;

    /**
     * @param out stream to print to, normally {@code System.err}
     */
    public FatalErrorReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "PrintStream must not be null");
    }

    /**
     * Print the error.
     *
     * @param error fatal error; must not be {@code null}
     * @return {@link #EXIT_CODE}
     */
    public int report(ConfigLoadException error) {
        Objects.requireNonNull(error, "error");
        out.println("Error: " + error.getMessage());
        for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
            out.println("Caused by: " + firstLine(cause));
        }
        if (!error.getHints().isEmpty()) {
            out.println();
            for (ErrorHint hint : error.getHints()) {
                out.println("Hint: " + hint.text());
            }
        }
        out.flush();
        return EXIT_CODE;
    }

    private static String firstLine(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
