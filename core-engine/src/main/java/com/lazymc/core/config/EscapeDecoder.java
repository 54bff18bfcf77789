package com.lazymc.core.config;

/**
 * Turns literal escape sequences in environment values into the characters
 * they stand for, so multi-line messages can be passed through a single
 * environment variable.
 *
 * <p>
 * Replacements run in a fixed order: {@code \n}, {@code \r}, {@code \t}, and
 * {@code \\} last.
 * </p>
 *
 * @since 1.0.0
 */
public final class EscapeDecoder {

    private EscapeDecoder() {
        // utility class
    }

    /**
     * @param input raw value; may be {@code null}
     * @return decoded value, or {@code null} if {@code input} was {@code null}
     */
    public static String decode(String input) {
        if (input == null || input.indexOf('\\') < 0) {
            return input;
        }
        return input
                .replace("\\n", "\n")
                .replace("\\r", "\r")
                .replace("\\t", "\t")
                .replace("\\\\", "\\");
    }
}
