package io.voxeldaemon.daemon.server;

/** A frame grew beyond {@code limits.max-message-bytes} before its terminator arrived. */
public final class FrameTooLargeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int limit;

    public FrameTooLargeException(int limit) {
        super("Message too large: frame exceeds " + limit + " bytes");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
