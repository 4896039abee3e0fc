package io.voxeldaemon.core.worker;

/** How a job ended, from the point of view of the party that answered it. */
public enum JobOutcome {
    /** Handler returned a result. */
    SUCCEEDED,
    /** Handler or gate raised a client-visible error. */
    FAILED,
    /** Handler threw something unexpected; answered with an internal error. */
    INTERNAL_ERROR,
    /** The watchdog answered because the job ran too long. */
    TIMED_OUT,
    /** Answered by the shutdown path. */
    ABORTED
}
