package io.voxeldaemon.daemon.lifecycle;

/** Inputs to the {@link LifecycleStateMachine}. */
public enum LifecycleEvent {
    /** Startup completed; the listener is accepting. */
    STARTED,
    /** TERM or INT, or a programmatic stop. */
    STOP_REQUESTED,
    /** HUP or a change of the watched configuration file. */
    RELOAD_REQUESTED,
    /** A registered auxiliary child process exited. */
    CHILD_EXITED,
    /** Every in-flight job was answered or abandoned and resources are released. */
    DRAIN_COMPLETE,
    /** An unrecoverable runtime failure, such as a dead selector. */
    FATAL_ERROR
}
