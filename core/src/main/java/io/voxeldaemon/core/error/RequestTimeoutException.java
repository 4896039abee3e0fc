package io.voxeldaemon.core.error;

/** A job exceeded its execution budget, either waiting for the engine or running. */
public final class RequestTimeoutException extends RpcException {

    private static final long serialVersionUID = 1L;

    public RequestTimeoutException(String message) {
        super(ErrorCode.REQUEST_TIMEOUT, message);
    }
}
