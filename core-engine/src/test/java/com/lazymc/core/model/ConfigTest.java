package com.lazymc.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Config} and its section builders.
 */
class ConfigTest {

    private static Config withDirectory(String directory) {
        return Config.builder()
                .server(ServerConfig.builder().command("run").directory(directory).build())
                .build();
    }

    // ------------------------------------------------------------------
    // Server directory
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should return the declared directory when there is no source file")
    void shouldKeepDeclaredDirectoryWithoutPath() {
        assertThat(withDirectory("server").serverDirectory()).isEqualTo(Path.of("server"));
    }

    @Test
    @DisplayName("Should resolve the declared directory against the file's parent")
    void shouldResolveAgainstFileParent() {
        Config config = withDirectory("server").withPath(Path.of("/opt/lazymc/lazymc.toml"));

        assertThat(config.serverDirectory()).isEqualTo(Path.of("/opt/lazymc/server"));
    }

    @Test
    @DisplayName("Should resolve the default directory to the file's parent")
    void shouldResolveDefaultDirectory() {
        Config config = withDirectory(".").withPath(Path.of("/opt/lazymc/lazymc.toml"));

        assertThat(config.serverDirectory().normalize()).isEqualTo(Path.of("/opt/lazymc"));
    }

    @Test
    @DisplayName("Should keep an absolute declared directory")
    void shouldKeepAbsoluteDirectory() {
        Config config = withDirectory("/srv/minecraft").withPath(Path.of("/opt/lazymc/lazymc.toml"));

        assertThat(config.serverDirectory()).isEqualTo(Path.of("/srv/minecraft"));
    }

    @Test
    @DisplayName("withPath should return a copy and leave the original untouched")
    void shouldCopyOnWithPath() {
        Config original = withDirectory("server");
        Config copy = original.withPath(Path.of("/opt/lazymc/lazymc.toml"));

        assertThat(original.getPath()).isEmpty();
        assertThat(copy.getPath()).contains(Path.of("/opt/lazymc/lazymc.toml"));
        assertThat(copy.getServer()).isSameAs(original.getServer());
        assertThat(copy).isNotEqualTo(original);
    }

    // ------------------------------------------------------------------
    // Builders
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should require a server section")
    void shouldRequireServer() {
        assertThatThrownBy(() -> Config.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("[server]");
    }

    @Test
    @DisplayName("Should require a server command")
    void shouldRequireCommand() {
        assertThatThrownBy(() -> ServerConfig.builder().directory("server").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("command");
    }

    @Test
    @DisplayName("Should reject values outside the unsigned range")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> TimeConfig.builder().sleepAfter(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeConfig.builder().sleepAfter(4_294_967_296L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RconConfig.builder().port(65_536))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(TimeConfig.builder().sleepAfter(4_294_967_295L).build().getSleepAfter())
                .isEqualTo(4_294_967_295L);
    }

    @Test
    @DisplayName("Join methods should not change when the source list does")
    void shouldCopyJoinMethods() {
        List<JoinMethod> methods = new ArrayList<>(List.of(JoinMethod.LOBBY));
        JoinConfig join = JoinConfig.builder().methods(methods).build();

        methods.add(JoinMethod.KICK);

        assertThat(join.getMethods()).containsExactly(JoinMethod.LOBBY);
    }

    @Test
    @DisplayName("Should look up join methods ignoring case")
    void shouldLookUpJoinMethods() {
        assertThat(JoinMethod.fromId("Forward")).contains(JoinMethod.FORWARD);
        assertThat(JoinMethod.fromId("teleport")).isEmpty();
        assertThat(JoinMethod.fromId(null)).isEmpty();
    }

    @Test
    @DisplayName("Should mask the RCON password in toString")
    void shouldMaskRconPassword() {
        RconConfig rcon = RconConfig.builder().password("hunter2").build();

        assertThat(rcon.toString()).doesNotContain("hunter2").contains("***");
        assertThat(RconConfig.defaults().getPassword()).isEmpty();
    }

    @Test
    @DisplayName("Sections with equal values should be equal")
    void shouldCompareByValue() {
        assertThat(withDirectory("server")).isEqualTo(withDirectory("server"));
        assertThat(withDirectory("server").hashCode()).isEqualTo(withDirectory("server").hashCode());
        assertThat(withDirectory("server")).isNotEqualTo(withDirectory("other"));
    }
}
