package io.voxeldaemon.core.worker;

/** Lifecycle of a worker thread. */
public enum WorkerState {
    IDLE,
    BUSY,
    /** Timed out or shut down; the thread exits once its current job returns. */
    RETIRED
}
