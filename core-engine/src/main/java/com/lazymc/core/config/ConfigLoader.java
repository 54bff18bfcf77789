package com.lazymc.core.config;

import com.lazymc.core.model.Config;
import com.lazymc.core.version.VersionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Produces the startup {@link Config} from exactly one source.
 *
 * <h3>Source selection</h3>
 * <ol>
 * <li>If the candidate path is a regular file, the configuration is decoded
 * from that TOML file and remembers its canonical path.</li>
 * <li>Otherwise the configuration is decoded from {@code LAZYMC_*}
 * environment variables (see {@link EnvironmentKeys}).</li>
 * </ol>
 * <p>
 * Values are never merged across the two sources.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * An unreadable or invalid file, or a missing
 * {@link EnvironmentKeys#SERVER_COMMAND}, raises a
 * {@link ConfigLoadException}. A missing, outdated or invalid
 * {@code [config] version} only logs a warning.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Configuration file name used when no path is given. */
    public static final String DEFAULT_CONFIG_FILE = "lazymc.toml";

    private static final List<ErrorHint> FILE_HINTS = List.of(ErrorHint.CONFIG_PATH, ErrorHint.CONFIG_VALIDATE);

    private ConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load from {@code candidate} if it is a file, else from the process
     * environment.
     *
     * @param candidate configuration file path; must not be {@code null}
     * @return fully populated configuration
     * @throws ConfigLoadException on any fatal configuration error
     */
    public static Config load(Path candidate) {
        return load(candidate, EnvironmentSource.system());
    }

    /**
     * Load from {@code candidate} if it is a file, else from {@code env}.
     *
     * @param candidate configuration file path; must not be {@code null}
     * @param env       environment used when there is no file; must not be
     *                  {@code null}
     * @return fully populated configuration
     * @throws ConfigLoadException on any fatal configuration error
     */
    public static Config load(Path candidate, EnvironmentSource env) {
        Objects.requireNonNull(candidate, "Config path must not be null");
        Objects.requireNonNull(env, "EnvironmentSource must not be null");

        Path path = canonicalize(candidate);
        if (Files.isRegularFile(path)) {
            LOG.info("Loading config from {}", path);
            return loadFromFile(path);
        }

        LOG.info("Config file not found at {}, using environment variables and defaults", path);
        return loadFromEnvironment(env);
    }

    /**
     * Load from a TOML file.
     *
     * @param path configuration file; must not be {@code null}
     * @return configuration carrying {@code path} as its source
     * @throws ConfigLoadException if the file cannot be read or decoded
     */
    public static Config loadFromFile(Path path) {
        Objects.requireNonNull(path, "Config path must not be null");

        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load config: could not read " + path, e, FILE_HINTS);
        }

        Config config;
        try {
            config = new TomlConfigDecoder().decode(text);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new ConfigLoadException("Failed to load config: invalid config file " + path, e, FILE_HINTS);
        }

        VersionCheck.Result version = VersionCheck.defaultCheck().check(config.getMeta().getVersion());
        if (version.isWarning()) {
            LOG.warn(version.message());
        }
        return config.withPath(path);
    }

    /**
     * Load from environment variables.
     *
     * @param env variable lookup; must not be {@code null}
     * @return configuration without a source path
     * @throws ConfigLoadException if the server command variable is missing
     */
    public static Config loadFromEnvironment(EnvironmentSource env) {
        return new EnvironmentConfigDecoder(env).decode();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Path canonicalize(Path candidate) {
        if (!Files.exists(candidate)) {
            return candidate.toAbsolutePath().normalize();
        }
        try {
            return candidate.toRealPath();
        } catch (IOException e) {
            LOG.debug("Could not canonicalize {}: {}", candidate, e.getMessage());
            return candidate.toAbsolutePath().normalize();
        }
    }
}
