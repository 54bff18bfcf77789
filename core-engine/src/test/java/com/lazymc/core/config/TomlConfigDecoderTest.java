package com.lazymc.core.config;

import com.lazymc.core.model.Config;
import com.lazymc.core.model.JoinMethod;
import com.lazymc.core.model.JoinConfig;
import com.lazymc.core.model.MotdConfig;
import com.lazymc.core.model.PublicConfig;
import com.lazymc.core.model.RconConfig;
import com.lazymc.core.model.TimeConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TomlConfigDecoder}.
 */
class TomlConfigDecoderTest {

    private final TomlConfigDecoder decoder = new TomlConfigDecoder();

    @Test
    @DisplayName("Should fill every omitted section with defaults")
    void shouldApplyDefaults() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "java -jar server.jar"
                """);

        assertThat(config.getPath()).isEmpty();
        assertThat(config.getServer().getCommand()).isEqualTo("java -jar server.jar");
        assertThat(config.getServer().getDirectory()).isEqualTo(Path.of("."));
        assertThat(config.getServer().getAddress()).isEqualTo(new InetSocketAddress("127.0.0.1", 25566));
        assertThat(config.getPublic()).isEqualTo(PublicConfig.defaults());
        assertThat(config.getTime()).isEqualTo(TimeConfig.defaults());
        assertThat(config.getMotd()).isEqualTo(MotdConfig.defaults());
        assertThat(config.getJoin()).isEqualTo(JoinConfig.defaults());
        assertThat(config.getRcon()).isEqualTo(RconConfig.defaults());
        assertThat(config.getMeta().getVersion()).isEmpty();
    }

    @Test
    @DisplayName("Should read explicit values from every table")
    void shouldReadValues() throws IOException {
        Config config = decoder.decode("""
                [public]
                address = "0.0.0.0:25570"
                version = "1.19.4"
                protocol = 762

                [server]
                directory = "/srv/mc"
                command = "./start.sh"
                address = "[::1]:25580"
                freeze_process = false
                start_timeout = 600

                [time]
                sleep_after = 300
                min_online_time = 120

                [motd]
                sleeping = "Sleeping"
                from_server = true

                [join]
                methods = ["forward", "kick"]

                [join.forward]
                address = "10.0.0.2:25565"
                send_proxy_v2 = true

                [join.lobby]
                ready_sound = "entity.player.levelup"

                [lockout]
                enabled = true

                [rcon]
                enabled = true
                port = 25576
                password = "secret"

                [advanced]
                rewrite_server_properties = false

                [config]
                version = "0.2.10"
                """);

        assertThat(config.getPublic().getAddress().getPort()).isEqualTo(25570);
        assertThat(config.getPublic().getVersion()).isEqualTo("1.19.4");
        assertThat(config.getPublic().getProtocol()).isEqualTo(762);
        assertThat(config.getServer().getDirectory()).isEqualTo(Path.of("/srv/mc"));
        assertThat(config.getServer().getAddress().getAddress().isLoopbackAddress()).isTrue();
        assertThat(config.getServer().isFreezeProcess()).isFalse();
        assertThat(config.getServer().getStartTimeout()).isEqualTo(600);
        assertThat(config.getTime().getSleepAfter()).isEqualTo(300);
        assertThat(config.getTime().getMinOnlineTime()).isEqualTo(120);
        assertThat(config.getMotd().getSleeping()).isEqualTo("Sleeping");
        assertThat(config.getMotd().getStarting()).isEqualTo(MotdConfig.DEFAULT_STARTING);
        assertThat(config.getMotd().isFromServer()).isTrue();
        assertThat(config.getJoin().getMethods()).containsExactly(JoinMethod.FORWARD, JoinMethod.KICK);
        assertThat(config.getJoin().getForward().getAddress()).isEqualTo(new InetSocketAddress("10.0.0.2", 25565));
        assertThat(config.getJoin().getForward().isSendProxyV2()).isTrue();
        assertThat(config.getJoin().getLobby().getReadySound()).contains("entity.player.levelup");
        assertThat(config.getLockout().isEnabled()).isTrue();
        assertThat(config.getRcon().isEnabled()).isTrue();
        assertThat(config.getRcon().getPort()).isEqualTo(25576);
        assertThat(config.getRcon().getPassword()).isEqualTo("secret");
        assertThat(config.getAdvanced().isRewriteServerProperties()).isFalse();
        assertThat(config.getMeta().getVersion()).contains("0.2.10");
    }

    @Test
    @DisplayName("Should ignore unknown tables and keys")
    void shouldIgnoreUnknownKeys() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "run"
                colour = "blue"

                [plugins]
                enabled = true
                """);

        assertThat(config.getServer().getCommand()).isEqualTo("run");
    }

    @Test
    @DisplayName("Should accept the old minimum_online_time key")
    void shouldAcceptMinimumOnlineTimeAlias() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "run"

                [time]
                minimum_online_time = 90
                """);

        assertThat(config.getTime().getMinOnlineTime()).isEqualTo(90);
    }

    @Test
    @DisplayName("Should keep an explicitly empty join method list")
    void shouldKeepEmptyMethods() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "run"

                [join]
                methods = []
                """);

        assertThat(config.getJoin().getMethods()).isEmpty();
    }

    @Test
    @DisplayName("Should treat an empty ready sound as no sound")
    void shouldTreatEmptyReadySoundAsNone() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "run"

                [join.lobby]
                ready_sound = ""
                """);

        assertThat(config.getJoin().getLobby().getReadySound()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve hostnames in addresses")
    void shouldResolveHostname() throws IOException {
        Config config = decoder.decode("""
                [server]
                command = "run"
                address = "localhost:25570"
                """);

        assertThat(config.getServer().getAddress().isUnresolved()).isFalse();
        assertThat(config.getServer().getAddress().getPort()).isEqualTo(25570);
    }

    @ParameterizedTest(name = "{index}: {0}")
    @ValueSource(strings = {
            "",
            "[public]\nprotocol = 765\n",
            "[server]\ndirectory = \"srv\"\n",
            "[server]\ncommand = \"run\"\nstart_timeout = -1\n",
            "[server]\ncommand = \"run\"\nstop_timeout = 4294967296\n",
            "[server]\ncommand = \"run\"\naddress = \"127.0.0.1:notaport\"\n",
            "[server]\ncommand = \"run\"\naddress = \"::1:25565\"\n",
            "[server]\ncommand = \"run\"\nfreeze_process = \"yes\"\n",
            "[server]\ncommand = \"run\"\n[time]\nsleep_after = \"soon\"\n",
            "[server]\ncommand = \"run\"\n[time]\nsleep_after = 1.5\n",
            "[server]\ncommand = \"run\"\n[join]\nmethods = [\"teleport\"]\n",
            "[server]\ncommand = \"run\"\n[rcon]\nport = 70000\n",
            "[server\ncommand = \"run\"\n"
    })
    @DisplayName("Should reject invalid documents")
    void shouldRejectInvalidDocuments(String toml) {
        assertThatThrownBy(() -> decoder.decode(toml))
                .isInstanceOfAny(IOException.class, IllegalArgumentException.class, IllegalStateException.class);
    }

    @ParameterizedTest(name = "{index}: {0}")
    @ValueSource(strings = {
            "[server]\ncommand = 5\n",
            "[server]\ncommand = true\n",
            "[server]\ncommand = 1.5\n",
            "[server]\ncommand = \"run\"\ndirectory = 7\n",
            "[server]\ncommand = \"run\"\n[public]\nversion = 1.20\n",
            "[server]\ncommand = \"run\"\n[motd]\nsleeping = false\n",
            "[server]\ncommand = \"run\"\n[rcon]\npassword = 1234\n",
            "[server]\ncommand = \"run\"\n[join.lobby]\nready_sound = 3\n",
            "[server]\ncommand = \"run\"\n[config]\nversion = 0.3\n",
            "[server]\ncommand = \"run\"\n[join]\nmethods = [0]\n",
            "[server]\ncommand = \"run\"\n[join]\nmethods = [0, 3]\n",
            "[server]\ncommand = \"run\"\n[join]\nmethods = [true]\n"
    })
    @DisplayName("Should reject numbers and booleans in text and join method fields")
    void shouldRejectNonStringScalars(String toml) {
        assertThatThrownBy(() -> decoder.decode(toml))
                .isInstanceOf(IOException.class);
    }
}
