package io.voxeldaemon.core.engine;

/**
 * Engine-level status. Dimensions are zero and {@code projectName} is
 * {@code null} while no project is active.
 *
 * @param version     engine version string
 * @param hasProject  whether a project is active
 * @param projectName active project name
 * @param layerCount  number of layers in the active project
 * @param readOnly    whether the engine refuses mutations
 * @param width       project width
 * @param height      project height
 * @param depth       project depth
 */
public record EngineStatus(
        String version,
        boolean hasProject,
        String projectName,
        int layerCount,
        boolean readOnly,
        int width,
        int height,
        int depth) {}
