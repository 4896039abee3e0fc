package io.voxeldaemon.core.worker;

/**
 * Worker pool sizing.
 *
 * @param workerCount      fixed number of worker threads
 * @param queueCapacity    bound of the shared FIFO queue
 * @param requestTimeoutMs per-job execution budget; {@code 0} disables the watchdog
 * @param watchdogPeriodMs how often running jobs are checked against the budget
 */
public record WorkerPoolConfig(int workerCount, int queueCapacity, long requestTimeoutMs, long watchdogPeriodMs) {

    public static final long DEFAULT_WATCHDOG_PERIOD_MS = 50;

    public WorkerPoolConfig {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got " + queueCapacity);
        }
        if (requestTimeoutMs < 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be >= 0, got " + requestTimeoutMs);
        }
        if (watchdogPeriodMs < 1) {
            throw new IllegalArgumentException("watchdogPeriodMs must be >= 1, got " + watchdogPeriodMs);
        }
    }

    public WorkerPoolConfig(int workerCount, int queueCapacity, long requestTimeoutMs) {
        this(workerCount, queueCapacity, requestTimeoutMs, DEFAULT_WATCHDOG_PERIOD_MS);
    }
}
