package io.voxeldaemon.core.methods;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.testkit.CapturingReplyChannel;
import io.voxeldaemon.core.testkit.DispatchRig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end tests of the built-in methods through the dispatcher and worker pool. */
class BuiltinMethodsTest {

    private final DispatchRig rig = new DispatchRig();
    private final CapturingReplyChannel channel = new CapturingReplyChannel();
    private int nextId = 1;

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        rig.close();
    }

    /** Sends one request and waits for its response. */
    private JsonNode call(String method, String params) throws Exception {
        int id = nextId++;
        String frame = "{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\""
                + (params == null ? "" : ",\"params\":" + params) + ",\"id\":" + id + "}";
        rig.send(frame, channel);
        return channel.await(id, Duration.ofSeconds(5)).get(id - 1);
    }

    private JsonNode result(String method, String params) throws Exception {
        JsonNode response = call(method, params);
        assertThat(response.has("error")).as("error in %s", response).isFalse();
        return response.path("result");
    }

    @Test
    void versionDescribesDaemon() throws Exception {
        JsonNode version = result("version", null);

        assertThat(version.path("version").asText()).isEqualTo(DaemonVersion.VERSION);
        assertThat(version.path("type").asText()).isEqualTo("daemon");
        assertThat(version.path("protocol").asText()).isEqualTo("JSON-RPC 2.0");
    }

    @Test
    void listMethodsReportsEveryMethodWithItsClass() throws Exception {
        JsonNode list = result("list_methods", null);

        assertThat(list.path("count").asInt()).isEqualTo(16);
        assertThat(list.path("methods").findValuesAsText("method"))
                .contains("ping", "goxel.create_project", "goxel.export_model", "add_voxels");
        for (JsonNode method : list.path("methods")) {
            if (method.path("method").asText().equals("goxel.add_voxel")) {
                assertThat(method.path("mutation").asText()).isEqualTo("mutation");
            }
            if (method.path("method").asText().equals("goxel.get_voxel")) {
                assertThat(method.path("mutation").asText()).isEqualTo("query");
            }
        }
    }

    @Test
    void statusIncludesCountersAndMethodCount() throws Exception {
        JsonNode status = result("status", null);

        assertThat(status.path("methods_available").asInt()).isEqualTo(16);
        assertThat(status.has("requests_received")).isTrue();
    }

    @Test
    void echoReturnsParamsOrEmptyObject() throws Exception {
        assertThat(result("echo", "{\"a\":[1,2]}").toString()).isEqualTo("{\"a\":[1,2]}");
        assertThat(result("echo", null).toString()).isEqualTo("{}");
    }

    @Test
    void editingSession() throws Exception {
        JsonNode created = result("goxel.create_project", "{\"name\":\"castle\",\"width\":32}");
        assertThat(created.path("success").asBoolean()).isTrue();
        assertThat(created.path("width").asInt()).isEqualTo(32);
        assertThat(created.path("height").asInt()).isEqualTo(64);

        JsonNode layer = result("goxel.create_layer", "{\"name\":\"roof\",\"r\":200}");
        assertThat(layer.path("id").asInt()).isEqualTo(1);

        JsonNode added = result("goxel.add_voxel", "{\"x\":4,\"y\":5,\"z\":6,\"r\":1,\"g\":2,\"b\":3,\"layer_id\":1}");
        assertThat(added.path("color").toString()).isEqualTo("[1,2,3,255]");
        assertThat(added.path("layer_id").asInt()).isEqualTo(1);

        JsonNode voxel = result("goxel.get_voxel", "[4,5,6]");
        assertThat(voxel.path("exists").asBoolean()).isTrue();

        JsonNode layers = result("goxel.list_layers", null);
        assertThat(layers.path("count").asInt()).isEqualTo(2);
        assertThat(layers.path("layers").get(1).path("name").asText()).isEqualTo("roof");

        JsonNode removed = result("goxel.remove_voxel", "{\"x\":4,\"y\":5,\"z\":6,\"layer_id\":1}");
        assertThat(removed.path("removed").asBoolean()).isTrue();
        assertThat(result("goxel.get_voxel", "[4,5,6]").path("color").isNull()).isTrue();

        JsonNode status = result("goxel.get_status", null);
        assertThat(status.path("layer_count").asInt()).isEqualTo(2);
        assertThat(status.path("read_only").asBoolean()).isFalse();
        assertThat(status.path("project_name").asText()).isEqualTo("castle");
    }

    @Test
    void saveLoadAndExport() throws Exception {
        result("goxel.create_project", "{\"name\":\"p\",\"width\":8,\"height\":8,\"depth\":8}");
        result("goxel.add_voxel", "{\"x\":1,\"y\":1,\"z\":1,\"r\":255,\"g\":0,\"b\":0}");
        String project = tempDir.resolve("p.json").toString().replace("\\", "/");
        String model = tempDir.resolve("p.txt").toString().replace("\\", "/");

        assertThat(result("goxel.save_project", "{\"path\":\"" + project + "\"}").path("success").asBoolean())
                .isTrue();
        result("goxel.create_project", null);
        result("goxel.load_project", "{\"path\":\"" + project + "\"}");
        JsonNode export = result("goxel.export_model", "{\"path\":\"" + model + "\"}");

        assertThat(export.path("format").asText()).isEqualTo("txt");
        assertThat(Files.readString(Path.of(model))).contains("1 1 1 ff0000");
    }

    @Test
    void engineErrorsUseApplicationCodes() throws Exception {
        assertThat(call("goxel.list_layers", null).path("error").path("code").asInt()).isEqualTo(-32010);

        result("goxel.create_project", "{\"width\":4,\"height\":4,\"depth\":4}");
        assertThat(call("goxel.add_voxel", "[9,0,0,1,1,1]").path("error").path("code").asInt()).isEqualTo(-32014);
        assertThat(call("goxel.add_voxel", "{\"x\":0,\"y\":0,\"z\":0,\"r\":1,\"g\":1,\"b\":1,\"layer_id\":7}")
                        .path("error").path("code").asInt())
                .isEqualTo(-32011);
        assertThat(call("goxel.export_model", "{\"path\":\"x.gltf\"}").path("error").path("code").asInt())
                .isEqualTo(-32013);
    }

    @Test
    void getStatusWithoutProject() throws Exception {
        JsonNode status = result("goxel.get_status", null);

        assertThat(status.path("has_project").asBoolean()).isFalse();
        assertThat(status.path("project_name").isNull()).isTrue();
        assertThat(status.path("layer_count").asInt()).isZero();
    }

    @Test
    void addVoxelsCountsFailuresInsteadOfRaising() throws Exception {
        result("goxel.create_project", "{\"width\":4,\"height\":4,\"depth\":4}");

        JsonNode bulk = result("add_voxels", "{\"voxels\":["
                + "{\"x\":0,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3},"
                + "{\"x\":1,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3,\"a\":10},"
                + "{\"x\":1,\"y\":0,\"z\":0,\"r\":999,\"g\":2,\"b\":3},"
                + "{\"x\":9,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3},"
                + "\"junk\"]}");

        assertThat(bulk.path("added").asInt()).isEqualTo(2);
        assertThat(bulk.path("failed").asInt()).isEqualTo(3);
        assertThat(bulk.path("success").asBoolean()).isFalse();
    }

    @Test
    void addVoxelsRejectsAlphaThatIsNotAByte() throws Exception {
        result("goxel.create_project", "{\"width\":4,\"height\":4,\"depth\":4}");

        JsonNode bulk = result("add_voxels", "{\"voxels\":["
                + "{\"x\":0,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3,\"a\":2.5},"
                + "{\"x\":1,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3,\"a\":\"opaque\"},"
                + "{\"x\":2,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3,\"a\":4294967551},"
                + "{\"x\":3,\"y\":0,\"z\":0,\"r\":1,\"g\":2,\"b\":3,\"a\":256}]}");

        assertThat(bulk.path("added").asInt()).isZero();
        assertThat(bulk.path("failed").asInt()).isEqualTo(4);
        assertThat(result("goxel.get_voxel", "{\"x\":2,\"y\":0,\"z\":0}").path("exists").asBoolean()).isFalse();
    }

    @Test
    void malformedPathsAreInvalidParams() throws Exception {
        result("goxel.create_project", "{\"width\":4,\"height\":4,\"depth\":4}");
        String params = "{\"path\":\"bad\\u0000name.json\"}";

        for (String method : new String[] {"goxel.save_project", "goxel.load_project", "goxel.export_model"}) {
            JsonNode error = call(method, params).path("error");
            assertThat(error.path("code").asInt()).as(method).isEqualTo(-32602);
            assertThat(error.path("message").asText()).as(method).contains("path");
        }
    }

    @Test
    void addVoxelsNeedsArray() throws Exception {
        assertThat(call("add_voxels", "{\"voxels\":5}").path("error").path("code").asInt()).isEqualTo(-32602);
    }
}
