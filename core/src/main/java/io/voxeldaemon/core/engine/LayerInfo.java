package io.voxeldaemon.core.engine;

/**
 * Snapshot of one layer.
 *
 * @param id         layer id, unique within the project
 * @param name       display name
 * @param visible    whether the layer contributes to reads and exports
 * @param color      layer tint
 * @param voxelCount number of voxels currently set on the layer
 */
public record LayerInfo(int id, String name, boolean visible, Rgba color, int voxelCount) {}
