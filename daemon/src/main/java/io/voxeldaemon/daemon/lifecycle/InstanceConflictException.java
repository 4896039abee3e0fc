package io.voxeldaemon.daemon.lifecycle;

/** Another live daemon already owns the socket path or the pid file. */
public final class InstanceConflictException extends DaemonStartupException {

    private static final long serialVersionUID = 1L;

    public InstanceConflictException(String message) {
        super(message);
    }
}
