package io.voxeldaemon.core.registry;

import io.voxeldaemon.core.engine.VoxelEngine;

/**
 * Everything a handler may use while it runs.
 *
 * @param method   the registered method being invoked
 * @param params   params bound to the method's declared names
 * @param engine   the shared engine, already guarded by the gate
 * @param registry the registry the method was resolved from
 */
public record CallContext(RegisteredMethod method, Params params, VoxelEngine engine, MethodRegistry registry) {}
