package io.voxeldaemon.daemon.server;

/** Connection lifecycle. Only {@link #ACTIVE} connections accept responses. */
public enum ConnectionState {
    /** Accepted, not yet registered with the selector. */
    CONNECTING,
    ACTIVE,
    /** Flushing queued output before closing; no further reads. */
    CLOSING,
    CLOSED
}
