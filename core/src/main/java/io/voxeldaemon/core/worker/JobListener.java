package io.voxeldaemon.core.worker;

import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.rpc.Delivery;

/**
 * Observer of job execution, used for statistics. Callbacks run on worker,
 * watchdog or dispatching threads and must not block.
 */
public interface JobListener {

    JobListener NOOP = new JobListener() {};

    default void jobAccepted(Job job) {}

    /**
     * The job was refused at submission.
     *
     * @param reason {@link ErrorCode#SERVER_BUSY} or {@link ErrorCode#SHUTTING_DOWN}
     */
    default void jobRejected(Job job, ErrorCode reason) {}

    /**
     * @param outcome        how the job ended
     * @param delivery       what happened to the response
     * @param durationMillis time from enqueue to answer
     */
    default void jobCompleted(Job job, JobOutcome outcome, Delivery delivery, long durationMillis) {}

    /** A worker was retired because its job exceeded the timeout. */
    default void workerReplaced(String retiredWorker, String replacement) {}
}
