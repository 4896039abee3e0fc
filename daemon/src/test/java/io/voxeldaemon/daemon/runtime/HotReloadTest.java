package io.voxeldaemon.daemon.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.daemon.config.ConfigLoader;
import io.voxeldaemon.daemon.config.DaemonConfig;
import io.voxeldaemon.daemon.config.ResponseOrdering;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Reload re-reads the file and applies only the reloadable settings, without dropping connections. */
class HotReloadTest {

    @TempDir
    Path dir;

    private Path configFile;
    private DaemonApp app;

    @BeforeEach
    void setUp() {
        configFile = dir.resolve("voxel-daemon.yaml");
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
    }

    private void writeConfig(String extra) throws Exception {
        Files.writeString(configFile, String.join("\n",
                "socket:",
                "  path: " + dir.resolve("reload.sock"),
                "process:",
                "  pid-file: " + dir.resolve("reload.pid"),
                "logging:",
                "  level: WARN",
                extra,
                ""));
    }

    private void startFromFile() {
        app = DaemonApp.start(configFile, ConfigLoader.load(configFile), new TestDaemons.TestMethods().methods());
    }

    @Test
    void reload_appliesLimits_andKeepsConnections() throws Exception {
        writeConfig("limits:\n  max-connections: 10");
        startFromFile();
        try (RpcTestClient client = RpcTestClient.connect(app.socketPath())) {
            client.call("ping", null, 1);

            writeConfig(String.join("\n",
                    "limits:",
                    "  max-connections: 3",
                    "  idle-timeout-ms: 60000",
                    "protocol:",
                    "  response-ordering: strict",
                    "worker:",
                    "  request-timeout-ms: 1234"));
            app.requestReload();

            assertThat(app.reloadCount()).isEqualTo(1);
            assertThat(app.config().maxConnections()).isEqualTo(3);
            assertThat(app.config().idleTimeoutMs()).isEqualTo(60_000);
            assertThat(app.config().responseOrdering()).isEqualTo(ResponseOrdering.STRICT);
            assertThat(app.config().requestTimeoutMs()).isEqualTo(1234);
            assertThat(client.call("ping", null, 2).path("result").asText()).isEqualTo("pong");
        }
    }

    @Test
    void reload_ignoresRestartOnlySettings() throws Exception {
        writeConfig("worker:\n  count: 4");
        startFromFile();

        writeConfig("worker:\n  count: 9");
        app.requestReload();

        assertThat(app.reloadCount()).isEqualTo(1);
        assertThat(app.config().workerCount()).isEqualTo(4);
        try (RpcTestClient client = RpcTestClient.connect(app.socketPath())) {
            JsonNode status = client.call("status", null, 1).path("result");
            assertThat(status.path("workers").asInt()).isEqualTo(4);
        }
    }

    @Test
    void invalidFile_keepsRunningConfiguration() throws Exception {
        writeConfig("limits:\n  max-connections: 5");
        startFromFile();

        Files.writeString(configFile, "limits:\n  max-connections: [oops\n");
        app.requestReload();
        writeConfig("limits:\n  max-connections: 0");
        app.requestReload();

        assertThat(app.reloadCount()).isZero();
        assertThat(app.config().maxConnections()).isEqualTo(5);
        try (RpcTestClient client = RpcTestClient.connect(app.socketPath())) {
            assertThat(client.call("ping", null, 1).path("result").asText()).isEqualTo("pong");
        }
    }

    @Test
    void reloadedRequestTimeout_appliesToNewJobs() throws Exception {
        writeConfig("worker:\n  request-timeout-ms: 30000");
        startFromFile();

        writeConfig("worker:\n  request-timeout-ms: 150");
        app.requestReload();

        try (RpcTestClient client = RpcTestClient.connect(app.socketPath())) {
            JsonNode response = client.call("test.sleep", "{\"ms\":2000}", 1);
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32001);
        }
    }

    @Test
    void watchedConfig_reloadsOnChange() throws Exception {
        writeConfig("reload:\n  watch-config: true\n  debounce-ms: 50\nlimits:\n  max-connections: 10");
        startFromFile();

        Files.writeString(dir.resolve("unrelated.txt"), "noise");
        writeConfig("reload:\n  watch-config: true\n  debounce-ms: 50\nlimits:\n  max-connections: 4");

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (app.config().maxConnections() != 4 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(app.config().maxConnections()).isEqualTo(4);
    }

    @Test
    void restartOnlyChanges_namesEverySettingThatNeedsARestart() {
        DaemonConfig current = TestDaemons.config(dir).build();
        DaemonConfig loaded = current.toBuilder()
                .socketPath(dir.resolve("other.sock").toString())
                .workerCount(current.workerCount() + 1)
                .readyCommand("true")
                .reloadWatchConfig(true)
                .maxConnections(2)
                .build();

        assertThat(DaemonApp.restartOnlyChanges(current, loaded))
                .containsExactly("socket.path", "process.ready-command", "worker.count", "reload");
        assertThat(DaemonApp.restartOnlyChanges(current, current.toBuilder().maxConnections(2).build()))
                .isEmpty();
    }
}
