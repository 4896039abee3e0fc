package io.voxeldaemon.core.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The voxel editing engine shared by every client of the daemon.
 *
 * <p>
 * Implementations are <em>not</em> required to be thread-safe. The daemon
 * only calls them through an {@link EngineGate}, which guarantees that
 * mutating calls never overlap with any other call. Read-only methods may be
 * called concurrently with each other.
 *
 * <p>
 * Domain failures are reported as
 * {@link io.voxeldaemon.core.error.EngineException} with an engine error code
 * and a message that is safe to show to clients.
 */
public interface VoxelEngine extends AutoCloseable {

    // --- mutating ---

    /** Replaces the active project with a new, empty one holding a single layer. */
    ProjectInfo createProject(String name, int width, int height, int depth);

    /** Replaces the active project with the one stored at {@code path}. */
    ProjectInfo loadProject(Path path);

    /** Sets the voxel at a position on a layer, overwriting any existing voxel. */
    void addVoxel(int x, int y, int z, Rgba color, int layerId);

    /**
     * Clears the voxel at a position on a layer.
     *
     * @return {@code true} if a voxel was present
     */
    boolean removeVoxel(int x, int y, int z, int layerId);

    /** Appends a layer to the active project. A {@code null} name becomes {@code "Layer <id>"}. */
    LayerInfo createLayer(String name, Rgba color, boolean visible);

    // --- read-only ---

    /** Writes the active project to {@code path}. Does not change engine state. */
    void saveProject(Path path);

    /** The color at a position, taken from the top-most visible layer that has a voxel there. */
    Optional<Rgba> getVoxel(int x, int y, int z);

    /**
     * Exports the visible voxels.
     *
     * @param path   destination file
     * @param format format name, or {@code null} to derive it from the file extension
     * @return the format actually written
     */
    String exportModel(Path path, String format);

    EngineStatus status();

    List<LayerInfo> listLayers();

    /** Releases engine resources. Further calls are undefined. */
    @Override
    void close();
}
