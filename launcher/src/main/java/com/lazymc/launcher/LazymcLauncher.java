package com.lazymc.launcher;

import com.lazymc.core.config.ConfigLoadException;
import com.lazymc.core.config.ConfigLoader;
import com.lazymc.core.config.EnvironmentSource;
import com.lazymc.core.model.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Process entry point.
 *
 * <h3>Usage</h3>
 *
 * <pre>
 *   java -jar launcher.jar [config-file]
 * </pre>
 * <p>
 * The optional argument is the configuration file, {@code lazymc.toml} by
 * default. When that file does not exist the configuration comes from
 * {@code LAZYMC_*} environment variables. A fatal configuration error is
 * printed with hints and the process exits with status 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class LazymcLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(LazymcLauncher.class);

    private LazymcLauncher() {
        // entry point
    }

    public static void main(String[] args) {
        int status = run(args, EnvironmentSource.system(), System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Resolve the configuration and report the outcome.
     *
     * @param args command line arguments; only the first is used
     * @param env  environment used when the configuration file is absent
     * @param err  stream for fatal error reports
     * @return process exit status
     */
    static int run(String[] args, EnvironmentSource env, PrintStream err) {
        Path candidate = Path.of(args.length > 0 ? args[0] : ConfigLoader.DEFAULT_CONFIG_FILE);

        Config config;
        try {
            config = ConfigLoader.load(candidate, env);
        } catch (ConfigLoadException e) {
            LOG.debug("Configuration failed to load", e);
            return new FatalErrorReporter(err).report(e);
        }

        logSummary(config);
        return 0;
    }

    private static void logSummary(Config config) {
        LOG.info("Configuration source: {}",
                config.getPath().map(Path::toString).orElse("environment variables"));
        LOG.info("Public address {}, server address {}, server directory {}",
                config.getPublic().getAddress(),
                config.getServer().getAddress(),
                config.serverDirectory());
        LOG.info("Server command: {}", config.getServer().getCommand());
        LOG.info("Sleep after {}s, join methods {}",
                config.getTime().getSleepAfter(),
                config.getJoin().getMethods());
        LOG.debug("Resolved configuration: {}", config);
    }
}
