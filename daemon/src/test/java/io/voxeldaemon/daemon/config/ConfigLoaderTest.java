package io.voxeldaemon.daemon.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link ConfigLoader} YAML parsing. */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    private static DaemonConfig loadWithoutEnv(Path path) {
        return ConfigLoader.load(path, Map.<String, String>of()::get);
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Explicit keys are read, everything else defaults")
        void loadMinimalConfig_defaultsApplied() throws Exception {
            DaemonConfig config = loadWithoutEnv(fixture("minimal-config.yaml"));

            assertThat(config.socketPath()).isEqualTo("/run/voxel/minimal.sock");
            assertThat(config.pidFile()).isEqualTo("/run/voxel/minimal.pid");

            assertThat(config.socketPermissions()).isEqualTo("0666");
            assertThat(config.daemonize()).isFalse();
            assertThat(config.hasReadyCommand()).isFalse();
            assertThat(config.workerCount()).isEqualTo(4);
            assertThat(config.queueSize()).isEqualTo(1000);
            assertThat(config.requestTimeoutMs()).isEqualTo(30_000);
            assertThat(config.maxConnections()).isEqualTo(10);
            assertThat(config.maxMessageBytes()).isEqualTo(10_485_760);
            assertThat(config.idleTimeoutMs()).isZero();
            assertThat(config.maxPendingOutputBytes()).isEqualTo(16_777_216);
            assertThat(config.responseOrdering()).isEqualTo(ResponseOrdering.ID);
            assertThat(config.shutdownGraceMs()).isEqualTo(10_000);
            assertThat(config.reloadWatchConfig()).isFalse();
            assertThat(config.reloadDebounceMs()).isEqualTo(500);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Every section maps onto the record")
        void loadFullConfig_allFieldsPopulated() throws Exception {
            DaemonConfig config = loadWithoutEnv(fixture("full-config.yaml"));

            assertThat(config.socketPath()).isEqualTo("/run/voxel/full.sock");
            assertThat(config.socketPermissions()).isEqualTo("0660");
            assertThat(config.pidFile()).isEqualTo("/run/voxel/full.pid");
            assertThat(config.daemonize()).isTrue();
            assertThat(config.readyCommand()).isEqualTo("/usr/local/bin/notify-ready --quiet");
            assertThat(config.workerCount()).isEqualTo(8);
            assertThat(config.queueSize()).isEqualTo(250);
            assertThat(config.requestTimeoutMs()).isEqualTo(15_000);
            assertThat(config.maxConnections()).isEqualTo(32);
            assertThat(config.maxMessageBytes()).isEqualTo(65_536);
            assertThat(config.idleTimeoutMs()).isEqualTo(60_000);
            assertThat(config.maxPendingOutputBytes()).isEqualTo(1_048_576);
            assertThat(config.responseOrdering()).isEqualTo(ResponseOrdering.STRICT);
            assertThat(config.shutdownGraceMs()).isEqualTo(2_500);
            assertThat(config.reloadWatchConfig()).isTrue();
            assertThat(config.reloadDebounceMs()).isEqualTo(200);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }
    }

    @Nested
    @DisplayName("Error paths")
    class ErrorPaths {

        @Test
        void missingFile_throwsWithPath(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> loadWithoutEnv(missing))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining(missing.toString());
        }

        @Test
        void malformedYaml_throwsParseError() throws Exception {
            assertThatThrownBy(() -> loadWithoutEnv(fixture("malformed.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void nonNumericValue_namesTheKey() throws Exception {
            assertThatThrownBy(() -> loadWithoutEnv(fixture("bad-numbers.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("worker.count");
        }

        @Test
        void outOfRangeValues_allReportedTogether() throws Exception {
            assertThatThrownBy(() -> loadWithoutEnv(fixture("out-of-range.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("worker.count")
                    .hasMessageContaining("worker.queue-size")
                    .hasMessageContaining("limits.max-message-bytes")
                    .hasMessageContaining("logging.format");
        }

        @Test
        void unknownOrdering_namesTheKey() throws Exception {
            assertThatThrownBy(() -> loadWithoutEnv(fixture("unknown-ordering.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("protocol.response-ordering")
                    .hasMessageContaining("fifo");
        }

        @Test
        void scalarRoot_rejected(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("scalar.yaml"), "just a string\n");

            assertThatThrownBy(() -> loadWithoutEnv(file))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("mapping");
        }
    }

    @Nested
    @DisplayName("Command line")
    class CommandLine {

        @Test
        void emptyFile_yieldsDefaults(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThat(loadWithoutEnv(file)).isEqualTo(DaemonConfig.defaults());
        }

        @Test
        void defaultConfigPath_whenNoFlag() {
            CommandLineOptions options = CommandLineOptions.parse(new String[0]);

            assertThat(options.configPath()).isEqualTo(Path.of("voxel-daemon.yaml"));
            assertThat(options.explicitConfig()).isFalse();
            assertThat(options.daemonize()).isFalse();
        }

        @Test
        void explicitConfig_andFlags() {
            CommandLineOptions options =
                    CommandLineOptions.parse(new String[] {"--daemonize", "--config", "/etc/voxeld.yaml"});

            assertThat(options.configPath()).isEqualTo(Path.of("/etc/voxeld.yaml"));
            assertThat(options.explicitConfig()).isTrue();
            assertThat(options.shouldDetach(DaemonConfig.defaults())).isTrue();
        }

        @Test
        void foreground_overridesConfiguredDaemonize() {
            CommandLineOptions options = CommandLineOptions.parse(new String[] {"--foreground"});
            DaemonConfig daemonizing = DaemonConfig.builder().daemonize(true).build();

            assertThat(options.shouldDetach(daemonizing)).isFalse();
        }

        @Test
        void configFlagWithoutValue_rejected() {
            assertThatThrownBy(() -> CommandLineOptions.parse(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }

        @Test
        void unknownFlag_rejected() {
            assertThatThrownBy(() -> CommandLineOptions.parse(new String[] {"--verbose"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--verbose");
        }

        @Test
        void explicitMissingConfig_isAnError(@TempDir Path dir) {
            String missing = dir.resolve("absent.yaml").toString();
            CommandLineOptions options = CommandLineOptions.parse(new String[] {"--config", missing});

            assertThatThrownBy(() -> ConfigLoader.load(options))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining(missing);
        }
    }
}
