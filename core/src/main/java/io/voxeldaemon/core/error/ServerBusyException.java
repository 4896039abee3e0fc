package io.voxeldaemon.core.error;

/** The work queue is at capacity; the request was rejected without being queued. */
public final class ServerBusyException extends RpcException {

    private static final long serialVersionUID = 1L;

    public ServerBusyException(int capacity) {
        super(ErrorCode.SERVER_BUSY, "Server busy: work queue is full (capacity " + capacity + ")");
    }
}
