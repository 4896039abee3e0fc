package io.voxeldaemon.daemon.lifecycle;

/** The daemon could not reach RUNNING. The process exits non-zero. */
public class DaemonStartupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DaemonStartupException(String message) {
        super(message);
    }

    public DaemonStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
