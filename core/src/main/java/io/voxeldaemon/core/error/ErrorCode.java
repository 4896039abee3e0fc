package io.voxeldaemon.core.error;

/**
 * JSON-RPC error codes emitted by the daemon.
 *
 * <p>
 * The first five are the standard JSON-RPC 2.0 codes. Codes between
 * {@code -32000} and {@code -32009} report resource exhaustion and lifecycle
 * conditions of the daemon itself; codes from {@code -32010} downwards carry
 * domain errors surfaced by the voxel engine.
 */
public enum ErrorCode {
    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid Request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),

    SERVER_BUSY(-32000, "Server busy"),
    REQUEST_TIMEOUT(-32001, "Request timeout"),
    SHUTTING_DOWN(-32002, "Server shutting down"),
    TOO_MANY_CONNECTIONS(-32003, "Too many connections"),
    MESSAGE_TOO_LARGE(-32004, "Message too large"),

    NO_PROJECT(-32010, "No active project"),
    LAYER_NOT_FOUND(-32011, "Layer not found"),
    ENGINE_IO(-32012, "Engine I/O failure"),
    UNSUPPORTED_FORMAT(-32013, "Unsupported format"),
    OUT_OF_BOUNDS(-32014, "Position out of bounds");

    private final int code;
    private final String title;

    ErrorCode(int code, String title) {
        this.code = code;
        this.title = title;
    }

    /** Numeric code placed in the {@code error.code} member. */
    public int code() {
        return code;
    }

    /** Short default message for the code. */
    public String title() {
        return title;
    }

    /** Returns {@code true} for codes reserved for engine domain errors. */
    public boolean isEngineError() {
        return code <= NO_PROJECT.code && code > -32100;
    }
}
