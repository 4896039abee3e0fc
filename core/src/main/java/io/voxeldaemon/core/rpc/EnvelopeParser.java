package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.voxeldaemon.core.error.InvalidRequestException;

/**
 * Validates the JSON-RPC 2.0 request envelope of a single JSON value.
 *
 * <ul>
 *   <li>{@code jsonrpc} must be the string {@code "2.0"}</li>
 *   <li>{@code method} must be a non-empty string</li>
 *   <li>{@code id}, when present, must be a string, a number or null</li>
 *   <li>{@code params}, when present, must be an object or an array</li>
 * </ul>
 *
 * An object with a {@code method} string and no {@code id} member is a
 * notification attempt; envelope violations on it are reported as silent.
 */
public final class EnvelopeParser {

    private EnvelopeParser() {
        // utility class
    }

    public static Envelope parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Envelope.invalid(
                    new InvalidRequestException("Invalid Request: expected a JSON object"), NullNode.getInstance(), false);
        }

        boolean hasId = node.has("id");
        JsonNode id = node.get("id");
        JsonNode method = node.get("method");
        boolean notificationAttempt = !hasId && method != null && method.isTextual();
        boolean idReadable = hasId && (id.isTextual() || id.isNumber() || id.isNull());
        JsonNode errorId = idReadable ? id : NullNode.getInstance();

        String violation = violation(node, hasId, idReadable, method);
        if (violation != null) {
            return Envelope.invalid(new InvalidRequestException("Invalid Request: " + violation), errorId,
                    notificationAttempt);
        }
        JsonNode params = node.get("params");
        return Envelope.valid(new RpcRequest(hasId && !id.isNull() ? id : null, method.asText(), params));
    }

    private static String violation(JsonNode node, boolean hasId, boolean idReadable, JsonNode method) {
        JsonNode version = node.get("jsonrpc");
        if (version == null || !version.isTextual() || !RpcResponses.VERSION.equals(version.asText())) {
            return "'jsonrpc' must be \"2.0\"";
        }
        if (method == null || !method.isTextual()) {
            return "'method' must be a string";
        }
        if (method.asText().isEmpty()) {
            return "'method' must not be empty";
        }
        if (hasId && !idReadable) {
            return "'id' must be a string, number or null";
        }
        if (node.has("params")) {
            JsonNode params = node.get("params");
            if (!params.isObject() && !params.isArray()) {
                return "'params' must be an object or an array";
            }
        }
        return null;
    }
}
