package io.voxeldaemon.core.engine;

/**
 * Snapshot of the active project's identity and bounds.
 *
 * @param name   project name
 * @param width  extent along x
 * @param height extent along y
 * @param depth  extent along z
 */
public record ProjectInfo(String name, int width, int height, int depth) {}
