package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.error.RpcException;

/**
 * Builds JSON-RPC 2.0 response objects.
 *
 * <pre>{@code
 * {"jsonrpc":"2.0","result":"pong","id":1}
 * {"jsonrpc":"2.0","error":{"code":-32601,"message":"Method not found: nope","data":{"method":"nope"}},"id":2}
 * }</pre>
 *
 * <p>
 * Thread-safe; all methods are stateless.
 */
public final class RpcResponses {

    /** Protocol version tag required on every request and response. */
    public static final String VERSION = "2.0";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RpcResponses() {
        // utility class
    }

    /** Successful response carrying {@code result}. A Java {@code null} result becomes JSON null. */
    public static ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode node = NODES.objectNode();
        node.put("jsonrpc", VERSION);
        node.set("result", result == null ? NullNode.getInstance() : result);
        node.set("id", idOrNull(id));
        return node;
    }

    /** Error response for the given code using its default title as message. */
    public static ObjectNode error(JsonNode id, ErrorCode code) {
        return error(id, code.code(), code.title(), null);
    }

    /** Error response for the given code with a specific message. */
    public static ObjectNode error(JsonNode id, ErrorCode code, String message) {
        return error(id, code.code(), message, null);
    }

    /** Error response derived from an {@link RpcException}. */
    public static ObjectNode error(JsonNode id, RpcException e) {
        return error(id, e.code(), e.getMessage(), e.data());
    }

    /**
     * Error response with an explicit code, message and optional data.
     *
     * @param id      request id; {@code null} is written as JSON null
     * @param code    numeric error code
     * @param message client-safe message
     * @param data    optional structured detail, omitted when {@code null}
     * @return the response object
     */
    public static ObjectNode error(JsonNode id, int code, String message, JsonNode data) {
        ObjectNode node = NODES.objectNode();
        node.put("jsonrpc", VERSION);
        ObjectNode error = node.putObject("error");
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", data);
        }
        node.set("id", idOrNull(id));
        return node;
    }

    private static JsonNode idOrNull(JsonNode id) {
        return id == null ? NullNode.getInstance() : id;
    }
}
