package io.voxeldaemon.core.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Abstract base for every failure that is reported to a client as a JSON-RPC
 * error object. Never thrown directly; the concrete subclasses fix the
 * {@link ErrorCode}.
 *
 * <p>
 * The message of an {@code RpcException} is sent to the client verbatim, so it
 * must never carry internal diagnostics. Unexpected failures are not modelled
 * as {@code RpcException}s; the worker boundary turns them into
 * {@link ErrorCode#INTERNAL_ERROR} with a generic message.
 */
public abstract class RpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final transient JsonNode data;

    protected RpcException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected RpcException(ErrorCode errorCode, String message, JsonNode data) {
        this(errorCode, message, data, null);
    }

    protected RpcException(ErrorCode errorCode, String message, JsonNode data, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.data = data;
    }

    /** The error category. */
    public ErrorCode errorCode() {
        return errorCode;
    }

    /** Numeric JSON-RPC error code. */
    public int code() {
        return errorCode.code();
    }

    /** Optional structured detail for the {@code error.data} member, or {@code null}. */
    public JsonNode data() {
        return data;
    }
}
