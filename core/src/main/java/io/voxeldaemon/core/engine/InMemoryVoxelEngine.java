package io.voxeldaemon.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.error.EngineException;
import io.voxeldaemon.core.error.ErrorCode;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference engine holding one project in memory.
 *
 * <p>
 * Positions are zero-based and must lie inside the project bounds. Every
 * project starts with layer {@code 0}. Projects are persisted as JSON
 * documents tagged with {@value #FORMAT_MARKER}; exports support
 * {@code txt} (one {@code X Y Z RRGGBB} line per voxel) and {@code json}.
 *
 * <p>
 * Not thread-safe: callers go through {@link EngineGate}.
 */
public final class InMemoryVoxelEngine implements VoxelEngine {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryVoxelEngine.class);

    /** Value of the {@code format} member of a saved project file. */
    public static final String FORMAT_MARKER = "voxel-daemon-project";

    static final int FILE_VERSION = 1;

    /** Largest extent accepted along any axis. */
    public static final int MAX_EXTENT = 4096;

    private static final List<String> EXPORT_FORMATS = List.of("txt", "json");

    private final ObjectMapper mapper = new ObjectMapper();
    private final String version;
    private Project project;

    public InMemoryVoxelEngine(String version) {
        this.version = version;
    }

    @Override
    public ProjectInfo createProject(String name, int width, int height, int depth) {
        checkExtent("width", width);
        checkExtent("height", height);
        checkExtent("depth", depth);
        project = new Project(name, width, height, depth);
        project.addLayer(null, Rgba.WHITE, true);
        LOG.info("Created project '{}' ({}x{}x{})", name, width, height, depth);
        return project.info();
    }

    @Override
    public ProjectInfo loadProject(Path path) {
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new EngineException(ErrorCode.ENGINE_IO, "Cannot read project file: " + path, e);
        }
        if (root == null || !FORMAT_MARKER.equals(root.path("format").asText())) {
            throw new EngineException(ErrorCode.UNSUPPORTED_FORMAT, "Not a project file: " + path);
        }
        project = readProject(root, path);
        LOG.info("Loaded project '{}' from {}", project.name, path);
        return project.info();
    }

    @Override
    public void saveProject(Path path) {
        Project current = requireProject();
        ObjectNode root = mapper.createObjectNode();
        root.put("format", FORMAT_MARKER);
        root.put("version", FILE_VERSION);
        root.put("name", current.name);
        root.put("width", current.width);
        root.put("height", current.height);
        root.put("depth", current.depth);
        ArrayNode layers = root.putArray("layers");
        for (Layer layer : current.layers.values()) {
            ObjectNode node = layers.addObject();
            node.put("id", layer.id);
            node.put("name", layer.name);
            node.put("visible", layer.visible);
            node.set("color", colorArray(node, layer.color));
            ArrayNode voxels = node.putArray("voxels");
            layer.voxels.forEach((key, color) -> {
                ArrayNode v = voxels.addArray();
                v.add(unpackX(key)).add(unpackY(key)).add(unpackZ(key));
                v.add(color.r()).add(color.g()).add(color.b()).add(color.a());
            });
        }
        try {
            createParent(path);
            mapper.writeValue(path.toFile(), root);
        } catch (IOException e) {
            throw new EngineException(ErrorCode.ENGINE_IO, "Cannot write project file: " + path, e);
        }
    }

    @Override
    public void addVoxel(int x, int y, int z, Rgba color, int layerId) {
        Project current = requireProject();
        current.checkBounds(x, y, z);
        current.layer(layerId).voxels.put(pack(x, y, z), color);
    }

    @Override
    public boolean removeVoxel(int x, int y, int z, int layerId) {
        Project current = requireProject();
        current.checkBounds(x, y, z);
        return current.layer(layerId).voxels.remove(pack(x, y, z)) != null;
    }

    @Override
    public Optional<Rgba> getVoxel(int x, int y, int z) {
        Project current = requireProject();
        current.checkBounds(x, y, z);
        long key = pack(x, y, z);
        List<Layer> topDown = new ArrayList<>(current.layers.values());
        Collections.reverse(topDown);
        for (Layer layer : topDown) {
            if (layer.visible) {
                Rgba color = layer.voxels.get(key);
                if (color != null) {
                    return Optional.of(color);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String exportModel(Path path, String format) {
        Project current = requireProject();
        String resolved = resolveFormat(path, format);
        Map<Long, Rgba> merged = current.mergedVisible();
        try {
            createParent(path);
            if ("json".equals(resolved)) {
                writeJsonExport(path, current, merged);
            } else {
                writeTextExport(path, merged);
            }
        } catch (IOException e) {
            throw new EngineException(ErrorCode.ENGINE_IO, "Cannot write export file: " + path, e);
        }
        LOG.debug("Exported {} voxels to {} as {}", merged.size(), path, resolved);
        return resolved;
    }

    @Override
    public EngineStatus status() {
        if (project == null) {
            return new EngineStatus(version, false, null, 0, false, 0, 0, 0);
        }
        return new EngineStatus(version, true, project.name, project.layers.size(), false,
                project.width, project.height, project.depth);
    }

    @Override
    public List<LayerInfo> listLayers() {
        Project current = requireProject();
        List<LayerInfo> result = new ArrayList<>(current.layers.size());
        for (Layer layer : current.layers.values()) {
            result.add(layer.info());
        }
        return result;
    }

    @Override
    public LayerInfo createLayer(String name, Rgba color, boolean visible) {
        Project current = requireProject();
        return current.addLayer(name, color, visible).info();
    }

    @Override
    public void close() {
        project = null;
    }

    // --- internals ---

    private Project requireProject() {
        if (project == null) {
            throw new EngineException(ErrorCode.NO_PROJECT, "No active project; call goxel.create_project first");
        }
        return project;
    }

    private Project readProject(JsonNode root, Path path) {
        try {
            Project loaded = new Project(
                    root.path("name").asText("Untitled"),
                    root.path("width").asInt(),
                    root.path("height").asInt(),
                    root.path("depth").asInt());
            for (JsonNode node : root.path("layers")) {
                JsonNode c = node.path("color");
                Rgba tint = new Rgba(c.path(0).asInt(255), c.path(1).asInt(255), c.path(2).asInt(255),
                        c.path(3).asInt(255));
                Layer layer = loaded.putLayer(node.path("id").asInt(), node.path("name").asText(),
                        tint, node.path("visible").asBoolean(true));
                for (JsonNode v : node.path("voxels")) {
                    int x = v.path(0).asInt();
                    int y = v.path(1).asInt();
                    int z = v.path(2).asInt();
                    loaded.checkBounds(x, y, z);
                    layer.voxels.put(pack(x, y, z),
                            new Rgba(v.path(3).asInt(), v.path(4).asInt(), v.path(5).asInt(), v.path(6).asInt()));
                }
            }
            if (loaded.layers.isEmpty()) {
                loaded.addLayer(null, Rgba.WHITE, true);
            }
            return loaded;
        } catch (IllegalArgumentException e) {
            throw new EngineException(ErrorCode.ENGINE_IO, "Corrupt project file: " + path, e);
        }
    }

    private static String resolveFormat(Path path, String format) {
        String candidate = format;
        if (candidate == null || candidate.isBlank()) {
            String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            candidate = dot < 0 ? "" : fileName.substring(dot + 1);
        }
        candidate = candidate.toLowerCase(Locale.ROOT);
        if (!EXPORT_FORMATS.contains(candidate)) {
            throw new EngineException(ErrorCode.UNSUPPORTED_FORMAT,
                    "Unsupported export format '" + candidate + "' (supported: " + EXPORT_FORMATS + ")");
        }
        return candidate;
    }

    private void writeJsonExport(Path path, Project current, Map<Long, Rgba> merged) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", current.name);
        ArrayNode size = root.putArray("size");
        size.add(current.width).add(current.height).add(current.depth);
        ArrayNode voxels = root.putArray("voxels");
        merged.forEach((key, color) -> {
            ObjectNode v = voxels.addObject();
            v.put("x", unpackX(key));
            v.put("y", unpackY(key));
            v.put("z", unpackZ(key));
            v.set("color", colorArray(v, color));
        });
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), root);
    }

    private static void writeTextExport(Path path, Map<Long, Rgba> merged) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("# Goxel compatible voxel list\n");
            out.write("# One line per voxel\n");
            out.write("# X Y Z RRGGBB\n");
            for (Map.Entry<Long, Rgba> e : merged.entrySet()) {
                long key = e.getKey();
                out.write(unpackX(key) + " " + unpackY(key) + " " + unpackZ(key) + " " + e.getValue().hex());
                out.write('\n');
            }
        }
    }

    private static ArrayNode colorArray(ObjectNode owner, Rgba color) {
        ArrayNode array = owner.arrayNode(4);
        array.add(color.r()).add(color.g()).add(color.b()).add(color.a());
        return array;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void checkExtent(String axis, int value) {
        if (value < 1 || value > MAX_EXTENT) {
            throw new EngineException(ErrorCode.OUT_OF_BOUNDS,
                    "Project " + axis + " must be between 1 and " + MAX_EXTENT + ", got " + value);
        }
    }

    // 21 bits per axis; coordinates are always in range once bounds-checked.
    static long pack(int x, int y, int z) {
        return ((long) x << 42) | ((long) y << 21) | z;
    }

    static int unpackX(long key) {
        return (int) (key >>> 42);
    }

    static int unpackY(long key) {
        return (int) ((key >>> 21) & 0x1FFFFF);
    }

    static int unpackZ(long key) {
        return (int) (key & 0x1FFFFF);
    }

    private static final class Project {
        final String name;
        final int width;
        final int height;
        final int depth;
        final TreeMap<Integer, Layer> layers = new TreeMap<>();

        Project(String name, int width, int height, int depth) {
            if (width < 1 || height < 1 || depth < 1 || width > MAX_EXTENT || height > MAX_EXTENT
                    || depth > MAX_EXTENT) {
                throw new IllegalArgumentException("invalid project extent " + width + "x" + height + "x" + depth);
            }
            this.name = name;
            this.width = width;
            this.height = height;
            this.depth = depth;
        }

        ProjectInfo info() {
            return new ProjectInfo(name, width, height, depth);
        }

        Layer addLayer(String layerName, Rgba color, boolean visible) {
            int id = layers.isEmpty() ? 0 : layers.lastKey() + 1;
            return putLayer(id, layerName == null ? "Layer " + id : layerName, color, visible);
        }

        Layer putLayer(int id, String layerName, Rgba color, boolean visible) {
            Layer layer = new Layer(id, layerName, color, visible);
            layers.put(id, layer);
            return layer;
        }

        Layer layer(int id) {
            Layer layer = layers.get(id);
            if (layer == null) {
                throw new EngineException(ErrorCode.LAYER_NOT_FOUND, "Layer " + id + " not found");
            }
            return layer;
        }

        void checkBounds(int x, int y, int z) {
            if (x < 0 || y < 0 || z < 0 || x >= width || y >= height || z >= depth) {
                throw new EngineException(ErrorCode.OUT_OF_BOUNDS, "Position (" + x + ", " + y + ", " + z
                        + ") is outside the project bounds " + width + "x" + height + "x" + depth);
            }
        }

        Map<Long, Rgba> mergedVisible() {
            Map<Long, Rgba> merged = new TreeMap<>();
            for (Layer layer : layers.values()) {
                if (layer.visible) {
                    merged.putAll(layer.voxels);
                }
            }
            return merged;
        }
    }

    private static final class Layer {
        final int id;
        final String name;
        final Rgba color;
        final boolean visible;
        final Map<Long, Rgba> voxels = new HashMap<>();

        Layer(int id, String name, Rgba color, boolean visible) {
            this.id = id;
            this.name = name;
            this.color = color;
            this.visible = visible;
        }

        LayerInfo info() {
            return new LayerInfo(id, name, visible, color, voxels.size());
        }
    }
}
