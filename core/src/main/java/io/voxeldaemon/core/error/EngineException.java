package io.voxeldaemon.core.error;

/**
 * Domain failure raised by the voxel engine (no project, unknown layer, file
 * I/O, unsupported export format). The message is client-safe: callers pass
 * the underlying exception as {@code cause} for logging, never in the message.
 */
public final class EngineException extends RpcException {

    private static final long serialVersionUID = 1L;

    public EngineException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public EngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(requireEngineCode(errorCode), message, null, cause);
    }

    private static ErrorCode requireEngineCode(ErrorCode errorCode) {
        if (!errorCode.isEngineError()) {
            throw new IllegalArgumentException("Not an engine error code: " + errorCode);
        }
        return errorCode;
    }
}
