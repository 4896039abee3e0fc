package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Single-assignment holder through which one request's response reaches its
 * connection. The first {@link #fill} wins; later calls return
 * {@link Delivery#DUPLICATE}, which is what guarantees exactly one response
 * per id even when a timeout races a late handler result.
 */
public interface ResponseSlot {

    /** Slot used for notifications: accepts anything, writes nothing. */
    ResponseSlot SILENT = new ResponseSlot() {
        @Override
        public Delivery fill(JsonNode response) {
            return Delivery.SILENT;
        }

        @Override
        public boolean isAbandoned() {
            return false;
        }
    };

    /**
     * Stores the response and, when complete, hands it to the connection.
     *
     * @param response a response object built by {@link RpcResponses}
     * @return what happened to the response
     */
    Delivery fill(JsonNode response);

    /** {@code true} once the originating connection has closed. */
    boolean isAbandoned();
}
