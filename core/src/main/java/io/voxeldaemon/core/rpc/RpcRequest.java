package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A syntactically valid JSON-RPC 2.0 request.
 *
 * @param id     client-supplied id (string or number), or {@code null} for a
 *               notification
 * @param method method name, never blank
 * @param params object or array params, or {@code null} when absent
 */
public record RpcRequest(JsonNode id, String method, JsonNode params) {

    /** A request without an id (absent or JSON null) expects no response. */
    public boolean isNotification() {
        return id == null || id.isNull();
    }

    /** The id to echo back; JSON null for notifications. */
    public JsonNode responseId() {
        return id == null ? NullNode.getInstance() : id;
    }
}
