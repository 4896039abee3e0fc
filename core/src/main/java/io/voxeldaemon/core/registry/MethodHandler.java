package io.voxeldaemon.core.registry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one JSON-RPC method. Invoked on a worker thread while the
 * engine gate is held for the method's {@link MutationClass}, so handlers
 * never synchronize on the engine themselves.
 *
 * <p>
 * Handlers report client-visible failures by throwing
 * {@link io.voxeldaemon.core.error.RpcException} subclasses. Anything else
 * thrown is treated as an internal error.
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * @param call bound params, the engine and the registry
     * @return the {@code result} value; {@code null} becomes JSON null
     */
    JsonNode handle(CallContext call);
}
