package io.voxeldaemon.core.error;

/** The message is valid JSON but not a valid JSON-RPC 2.0 request object. */
public final class InvalidRequestException extends RpcException {

    private static final long serialVersionUID = 1L;

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
