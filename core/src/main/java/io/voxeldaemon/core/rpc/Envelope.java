package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.error.InvalidRequestException;

/**
 * Result of checking one JSON value against the JSON-RPC 2.0 request
 * envelope. Exactly one of {@link #request()} and {@link #error()} is set.
 *
 * @param request the request, when the envelope is valid
 * @param error   the violation, when it is not
 * @param errorId id to answer the violation with (JSON null if unreadable)
 * @param silent  {@code true} for an invalid notification attempt, which is
 *                logged but never answered
 */
public record Envelope(RpcRequest request, InvalidRequestException error, JsonNode errorId, boolean silent) {

    static Envelope valid(RpcRequest request) {
        return new Envelope(request, null, null, false);
    }

    static Envelope invalid(InvalidRequestException error, JsonNode errorId, boolean silent) {
        return new Envelope(null, error, errorId, silent);
    }

    public boolean isValid() {
        return request != null;
    }

    /** Whether a response (result or error) will be produced for this element. */
    public boolean expectsResponse() {
        return isValid() ? !request.isNotification() : !silent;
    }
}
