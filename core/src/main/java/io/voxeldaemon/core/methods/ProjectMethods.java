package io.voxeldaemon.core.methods;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.engine.EngineStatus;
import io.voxeldaemon.core.engine.InMemoryVoxelEngine;
import io.voxeldaemon.core.engine.LayerInfo;
import io.voxeldaemon.core.engine.ProjectInfo;
import io.voxeldaemon.core.engine.Rgba;
import io.voxeldaemon.core.engine.VoxelEngine;
import io.voxeldaemon.core.error.EngineException;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.error.InvalidParamsException;
import io.voxeldaemon.core.registry.CallContext;
import io.voxeldaemon.core.registry.MethodRegistry;
import io.voxeldaemon.core.registry.MethodSpec;
import io.voxeldaemon.core.registry.Params;
import io.voxeldaemon.core.registry.Schemas;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The {@code goxel.*} editing methods and the bulk {@code add_voxels} method.
 * Result shapes follow the Goxel daemon wire format so existing clients keep
 * working.
 */
public final class ProjectMethods {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String DEFAULT_PROJECT_NAME = "New Project";
    static final int DEFAULT_EXTENT = 64;

    public void registerAll(MethodRegistry.Builder builder) {
        builder.register(MethodSpec.mutation("goxel.create_project")
                .description("Create a new voxel project")
                .optional("name", Schemas.nonEmptyString())
                .optional("width", Schemas.integer(1, InMemoryVoxelEngine.MAX_EXTENT))
                .optional("height", Schemas.integer(1, InMemoryVoxelEngine.MAX_EXTENT))
                .optional("depth", Schemas.integer(1, InMemoryVoxelEngine.MAX_EXTENT))
                .handler(ProjectMethods::createProject));
        builder.register(MethodSpec.mutation("goxel.load_project")
                .description("Load a project from file")
                .required("path", Schemas.nonEmptyString())
                .handler(ProjectMethods::loadProject));
        builder.register(MethodSpec.query("goxel.save_project")
                .description("Save project to file")
                .required("path", Schemas.nonEmptyString())
                .handler(ProjectMethods::saveProject));
        builder.register(MethodSpec.mutation("goxel.add_voxel")
                .description("Add a voxel at specified position")
                .required("x", Schemas.integer())
                .required("y", Schemas.integer())
                .required("z", Schemas.integer())
                .required("r", Schemas.colorComponent())
                .required("g", Schemas.colorComponent())
                .required("b", Schemas.colorComponent())
                .optional("a", Schemas.colorComponent())
                .optional("layer_id", Schemas.integer())
                .handler(ProjectMethods::addVoxel));
        builder.register(MethodSpec.mutation("goxel.remove_voxel")
                .description("Remove a voxel at specified position")
                .required("x", Schemas.integer())
                .required("y", Schemas.integer())
                .required("z", Schemas.integer())
                .optional("layer_id", Schemas.integer())
                .handler(ProjectMethods::removeVoxel));
        builder.register(MethodSpec.query("goxel.get_voxel")
                .description("Get voxel information at specified position")
                .required("x", Schemas.integer())
                .required("y", Schemas.integer())
                .required("z", Schemas.integer())
                .handler(ProjectMethods::getVoxel));
        builder.register(MethodSpec.query("goxel.export_model")
                .description("Export model to specified format")
                .required("path", Schemas.nonEmptyString())
                .optional("format", Schemas.nonEmptyString())
                .handler(ProjectMethods::exportModel));
        builder.register(MethodSpec.query("goxel.get_status")
                .description("Get current engine status and info")
                .handler(ProjectMethods::getStatus));
        builder.register(MethodSpec.query("goxel.list_layers")
                .description("List all layers in current project")
                .handler(ProjectMethods::listLayers));
        builder.register(MethodSpec.mutation("goxel.create_layer")
                .description("Create a new layer")
                .optional("name", Schemas.nonEmptyString())
                .optional("r", Schemas.colorComponent())
                .optional("g", Schemas.colorComponent())
                .optional("b", Schemas.colorComponent())
                .optional("visible", Schemas.bool())
                .handler(ProjectMethods::createLayer));
        builder.register(MethodSpec.mutation("add_voxels")
                .description("Add multiple voxels in batch")
                .required("voxels", Schemas.arrayOf(NODES.objectNode()))
                .handler(ProjectMethods::addVoxels));
    }

    private static JsonNode createProject(CallContext call) {
        Params p = call.params();
        ProjectInfo info = call.engine().createProject(
                p.optString("name", DEFAULT_PROJECT_NAME),
                p.optInt("width", DEFAULT_EXTENT),
                p.optInt("height", DEFAULT_EXTENT),
                p.optInt("depth", DEFAULT_EXTENT));
        ObjectNode node = success();
        node.put("name", info.name());
        node.put("width", info.width());
        node.put("height", info.height());
        node.put("depth", info.depth());
        return node;
    }

    private static JsonNode loadProject(CallContext call) {
        String path = call.params().requireString("path");
        call.engine().loadProject(toPath(path));
        return success().put("path", path);
    }

    private static JsonNode saveProject(CallContext call) {
        String path = call.params().requireString("path");
        call.engine().saveProject(toPath(path));
        return success().put("path", path);
    }

    private static Path toPath(String path) {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw new InvalidParamsException("Parameter 'path' is not a valid path: " + e.getReason());
        }
    }

    private static JsonNode addVoxel(CallContext call) {
        Params p = call.params();
        int x = p.requireInt("x");
        int y = p.requireInt("y");
        int z = p.requireInt("z");
        Rgba color = new Rgba(p.requireInt("r"), p.requireInt("g"), p.requireInt("b"), p.optInt("a", 255));
        int layerId = p.optInt("layer_id", 0);
        call.engine().addVoxel(x, y, z, color, layerId);
        ObjectNode node = success();
        putPosition(node, x, y, z);
        node.put("layer_id", layerId);
        node.set("color", colorArray(color));
        return node;
    }

    private static JsonNode removeVoxel(CallContext call) {
        Params p = call.params();
        int x = p.requireInt("x");
        int y = p.requireInt("y");
        int z = p.requireInt("z");
        int layerId = p.optInt("layer_id", 0);
        boolean removed = call.engine().removeVoxel(x, y, z, layerId);
        ObjectNode node = success();
        putPosition(node, x, y, z);
        node.put("layer_id", layerId);
        node.put("removed", removed);
        return node;
    }

    private static JsonNode getVoxel(CallContext call) {
        Params p = call.params();
        int x = p.requireInt("x");
        int y = p.requireInt("y");
        int z = p.requireInt("z");
        Optional<Rgba> color = call.engine().getVoxel(x, y, z);
        ObjectNode node = NODES.objectNode();
        putPosition(node, x, y, z);
        node.put("exists", color.isPresent());
        node.set("color", color.map(ProjectMethods::colorArray).map(JsonNode.class::cast).orElse(NullNode.getInstance()));
        return node;
    }

    private static JsonNode exportModel(CallContext call) {
        Params p = call.params();
        String path = p.requireString("path");
        String format = call.engine().exportModel(toPath(path), p.optString("format", null));
        return success().put("path", path).put("format", format);
    }

    private static JsonNode getStatus(CallContext call) {
        EngineStatus status = call.engine().status();
        ObjectNode node = NODES.objectNode();
        node.put("version", status.version());
        node.put("has_project", status.hasProject());
        if (status.hasProject()) {
            node.put("project_name", status.projectName());
        } else {
            node.putNull("project_name");
        }
        node.put("layer_count", status.layerCount());
        node.put("read_only", status.readOnly());
        node.put("width", status.width());
        node.put("height", status.height());
        node.put("depth", status.depth());
        return node;
    }

    private static JsonNode listLayers(CallContext call) {
        ObjectNode node = NODES.objectNode();
        ArrayNode layers = NODES.arrayNode();
        for (LayerInfo layer : call.engine().listLayers()) {
            ObjectNode entry = layers.addObject();
            entry.put("id", layer.id());
            entry.put("name", layer.name());
            entry.put("visible", layer.visible());
            entry.put("voxel_count", layer.voxelCount());
            entry.set("color", colorArray(layer.color()));
        }
        node.put("count", layers.size());
        node.set("layers", layers);
        return node;
    }

    private static JsonNode createLayer(CallContext call) {
        Params p = call.params();
        Rgba color = Rgba.opaque(p.optInt("r", 255), p.optInt("g", 255), p.optInt("b", 255));
        LayerInfo layer = call.engine().createLayer(p.optString("name", null), color, p.optBoolean("visible", true));
        ObjectNode node = success();
        node.put("id", layer.id());
        node.put("name", layer.name());
        node.put("visible", layer.visible());
        return node;
    }

    /** Malformed entries and per-voxel engine failures are counted, not raised. */
    private static JsonNode addVoxels(CallContext call) {
        VoxelEngine engine = call.engine();
        if (!engine.status().hasProject()) {
            throw new EngineException(ErrorCode.NO_PROJECT, "No active project; call goxel.create_project first");
        }
        int added = 0;
        int failed = 0;
        for (JsonNode voxel : call.params().requireArray("voxels")) {
            Rgba color = voxelColor(voxel);
            if (color == null) {
                failed++;
                continue;
            }
            try {
                engine.addVoxel(voxel.get("x").intValue(), voxel.get("y").intValue(), voxel.get("z").intValue(),
                        color, 0);
                added++;
            } catch (EngineException e) {
                failed++;
            }
        }
        ObjectNode node = NODES.objectNode();
        node.put("success", failed == 0);
        node.put("added", added);
        node.put("failed", failed);
        return node;
    }

    private static Rgba voxelColor(JsonNode voxel) {
        if (!voxel.isObject()) {
            return null;
        }
        for (String field : new String[] {"x", "y", "z", "r", "g", "b"}) {
            JsonNode value = voxel.get(field);
            if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
                return null;
            }
        }
        JsonNode alpha = voxel.get("a");
        if (alpha != null && (!alpha.isIntegralNumber() || !alpha.canConvertToInt())) {
            return null;
        }
        int a = alpha == null ? 255 : alpha.intValue();
        int r = voxel.get("r").intValue();
        int g = voxel.get("g").intValue();
        int b = voxel.get("b").intValue();
        if (!inColorRange(r) || !inColorRange(g) || !inColorRange(b) || !inColorRange(a)) {
            return null;
        }
        return new Rgba(r, g, b, a);
    }

    private static boolean inColorRange(int value) {
        return value >= 0 && value <= 255;
    }

    private static ObjectNode success() {
        return NODES.objectNode().put("success", true);
    }

    private static void putPosition(ObjectNode node, int x, int y, int z) {
        node.put("x", x);
        node.put("y", y);
        node.put("z", z);
    }

    private static ArrayNode colorArray(Rgba color) {
        ArrayNode array = NODES.arrayNode(4);
        array.add(color.r()).add(color.g()).add(color.b()).add(color.a());
        return array;
    }
}
