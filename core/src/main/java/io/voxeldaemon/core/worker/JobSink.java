package io.voxeldaemon.core.worker;

/** Accepts validated jobs for execution. Implemented by {@link WorkerPool}. */
public interface JobSink {

    /**
     * Enqueues a job without blocking.
     *
     * @throws io.voxeldaemon.core.error.ServerBusyException   if the queue is full
     * @throws io.voxeldaemon.core.error.ShuttingDownException if the pool no longer accepts work
     */
    void submit(Job job);
}
