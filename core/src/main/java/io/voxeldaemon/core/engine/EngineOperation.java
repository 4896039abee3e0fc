package io.voxeldaemon.core.engine;

/** A unit of work run against the engine while the gate is held. */
@FunctionalInterface
public interface EngineOperation<T> {
    T apply(VoxelEngine engine);
}
