package io.voxeldaemon.daemon.lifecycle;

import java.util.Locale;

/** Daemon lifecycle states, in the only order they are entered. */
public enum LifecycleState {
    INITIALIZING,
    RUNNING,
    /** Listener closed, new requests refused, in-flight work finishing. */
    DRAINING,
    STOPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
