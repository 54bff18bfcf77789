package com.lazymc.core.config;

/**
 * Remediation hints attached to a {@link ConfigLoadException} and shown to the
 * operator next to the error.
 *
 * @since 1.0.0
 */
public enum ErrorHint {

    /** The configuration file path can be changed. */
    CONFIG_PATH("Pass the path of a different configuration file as the first argument"),

    /** The configuration file should be checked. */
    CONFIG_VALIDATE("Validate the configuration file: it must be valid TOML with a [server] table and a 'command'"),

    /** The required environment variable is missing. */
    SERVER_COMMAND_ENV("Set " + EnvironmentKeys.SERVER_COMMAND
            + " to the server start command, or provide a configuration file");

    private final String text;

    ErrorHint(String text) {
        this.text = text;
    }

    /**
     * @return human readable hint text
     */
    public String text() {
        return text;
    }
}
