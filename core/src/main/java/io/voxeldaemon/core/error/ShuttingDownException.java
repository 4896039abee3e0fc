package io.voxeldaemon.core.error;

/** The daemon is draining and no longer accepts or finishes work. */
public final class ShuttingDownException extends RpcException {

    private static final long serialVersionUID = 1L;

    public ShuttingDownException(String message) {
        super(ErrorCode.SHUTTING_DOWN, message);
    }
}
