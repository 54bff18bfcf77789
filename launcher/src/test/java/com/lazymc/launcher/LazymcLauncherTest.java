package com.lazymc.launcher;

import com.lazymc.core.config.EnvironmentKeys;
import com.lazymc.core.config.EnvironmentSource;
import com.lazymc.core.config.ErrorHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LazymcLauncher}.
 */
class LazymcLauncherTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    @DisplayName("Should succeed with a valid configuration file")
    void shouldLoadFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("lazymc.toml"),
                "[server]\ncommand = \"run.sh\"\n[config]\nversion = \"0.2.11\"\n");

        int status = run(file.toString(), Map.of());

        assertThat(status).isZero();
        assertThat(errText()).isEmpty();
    }

    @Test
    @DisplayName("Should succeed from the environment when the file is missing")
    void shouldLoadEnvironment() {
        int status = run(tempDir.resolve("absent.toml").toString(),
                Map.of(EnvironmentKeys.SERVER_COMMAND, "java -jar server.jar"));

        assertThat(status).isZero();
        assertThat(errText()).isEmpty();
    }

    @Test
    @DisplayName("Should exit with status 1 and hints when the file is invalid")
    void shouldReportInvalidFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("lazymc.toml"), "[server\ncommand = \"run.sh\"\n");

        int status = run(file.toString(), Map.of(EnvironmentKeys.SERVER_COMMAND, "java -jar server.jar"));

        assertThat(status).isEqualTo(1);
        assertThat(errText())
                .startsWith("Error: Failed to load config: invalid config file")
                .contains("Caused by: ")
                .contains("Hint: " + ErrorHint.CONFIG_PATH.text())
                .contains("Hint: " + ErrorHint.CONFIG_VALIDATE.text());
    }

    @Test
    @DisplayName("Should exit with status 1 when neither file nor command is available")
    void shouldReportMissingCommand() {
        int status = run(tempDir.resolve("absent.toml").toString(), Map.of());

        assertThat(status).isEqualTo(1);
        assertThat(errText())
                .contains("Error: Missing required environment variable: " + EnvironmentKeys.SERVER_COMMAND)
                .contains("Hint: " + ErrorHint.SERVER_COMMAND_ENV.text());
    }

    private int run(String path, Map<String, String> env) {
        return LazymcLauncher.run(new String[] {path}, EnvironmentSource.of(env),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String errText() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
