package io.voxeldaemon.core.stats;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.rpc.Delivery;
import io.voxeldaemon.core.worker.Job;
import io.voxeldaemon.core.worker.JobListener;
import io.voxeldaemon.core.worker.JobOutcome;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide counters. Every update is a {@link LongAdder} increment, so
 * recording never contends between worker and I/O threads.
 */
public final class DaemonStats implements JobListener {

    private final Clock clock;
    private final Instant startedAt;

    private final LongAdder requestsReceived = new LongAdder();
    private final LongAdder notificationsReceived = new LongAdder();
    private final LongAdder batchesReceived = new LongAdder();
    private final LongAdder parseErrors = new LongAdder();
    private final LongAdder invalidRequests = new LongAdder();
    private final LongAdder methodNotFound = new LongAdder();
    private final LongAdder invalidParams = new LongAdder();

    private final LongAdder jobsAccepted = new LongAdder();
    private final LongAdder jobsSucceeded = new LongAdder();
    private final LongAdder jobsFailed = new LongAdder();
    private final LongAdder internalErrors = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder aborted = new LongAdder();
    private final LongAdder rejectedBusy = new LongAdder();
    private final LongAdder rejectedShuttingDown = new LongAdder();
    private final LongAdder responsesDiscarded = new LongAdder();
    private final LongAdder workersReplaced = new LongAdder();
    private final LongAdder totalLatencyMillis = new LongAdder();

    private final LongAdder connectionsAccepted = new LongAdder();
    private final LongAdder connectionsRejected = new LongAdder();
    private final LongAdder connectionsClosed = new LongAdder();
    private final LongAdder oversizedMessages = new LongAdder();

    public DaemonStats() {
        this(Clock.systemUTC());
    }

    public DaemonStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    // --- dispatcher ---

    public void requestReceived() {
        requestsReceived.increment();
    }

    public void notificationReceived() {
        notificationsReceived.increment();
    }

    public void batchReceived() {
        batchesReceived.increment();
    }

    /** A request was answered by the dispatcher without reaching a worker. */
    public void dispatchError(ErrorCode code) {
        switch (code) {
            case PARSE_ERROR -> parseErrors.increment();
            case INVALID_REQUEST -> invalidRequests.increment();
            case METHOD_NOT_FOUND -> methodNotFound.increment();
            case INVALID_PARAMS -> invalidParams.increment();
            default -> jobsFailed.increment();
        }
    }

    /** A response produced outside the worker pool could not be written. */
    public void responseDiscarded() {
        responsesDiscarded.increment();
    }

    // --- connections ---

    public void connectionAccepted() {
        connectionsAccepted.increment();
    }

    public void connectionRejected() {
        connectionsRejected.increment();
    }

    public void connectionClosed() {
        connectionsClosed.increment();
    }

    public void oversizedMessage() {
        oversizedMessages.increment();
    }

    // --- worker pool ---

    @Override
    public void jobAccepted(Job job) {
        jobsAccepted.increment();
    }

    @Override
    public void jobRejected(Job job, ErrorCode reason) {
        if (reason == ErrorCode.SERVER_BUSY) {
            rejectedBusy.increment();
        } else {
            rejectedShuttingDown.increment();
        }
    }

    @Override
    public void jobCompleted(Job job, JobOutcome outcome, Delivery delivery, long durationMillis) {
        switch (outcome) {
            case SUCCEEDED -> jobsSucceeded.increment();
            case FAILED -> jobsFailed.increment();
            case INTERNAL_ERROR -> internalErrors.increment();
            case TIMED_OUT -> timeouts.increment();
            case ABORTED -> aborted.increment();
        }
        if (delivery == Delivery.DISCARDED) {
            responsesDiscarded.increment();
        }
        totalLatencyMillis.add(durationMillis);
    }

    @Override
    public void workerReplaced(String retiredWorker, String replacement) {
        workersReplaced.increment();
    }

    // --- reads ---

    public Instant startedAt() {
        return startedAt;
    }

    public long uptimeSeconds() {
        return clock.instant().getEpochSecond() - startedAt.getEpochSecond();
    }

    public long requestsReceived() {
        return requestsReceived.sum();
    }

    public long responsesDiscarded() {
        return responsesDiscarded.sum();
    }

    public long timeouts() {
        return timeouts.sum();
    }

    public long rejectedBusy() {
        return rejectedBusy.sum();
    }

    public long workersReplaced() {
        return workersReplaced.sum();
    }

    public long jobsSucceeded() {
        return jobsSucceeded.sum();
    }

    /** Counter snapshot in the shape used by the {@code status} method. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("requests_received", requestsReceived.sum());
        node.put("notifications_received", notificationsReceived.sum());
        node.put("batches_received", batchesReceived.sum());
        node.put("parse_errors", parseErrors.sum());
        node.put("invalid_requests", invalidRequests.sum());
        node.put("method_not_found", methodNotFound.sum());
        node.put("invalid_params", invalidParams.sum());
        node.put("jobs_accepted", jobsAccepted.sum());
        node.put("jobs_succeeded", jobsSucceeded.sum());
        node.put("jobs_failed", jobsFailed.sum());
        node.put("internal_errors", internalErrors.sum());
        node.put("timeouts", timeouts.sum());
        node.put("aborted", aborted.sum());
        node.put("rejected_busy", rejectedBusy.sum());
        node.put("rejected_shutting_down", rejectedShuttingDown.sum());
        node.put("responses_discarded", responsesDiscarded.sum());
        node.put("workers_replaced", workersReplaced.sum());
        long finished = jobsSucceeded.sum() + jobsFailed.sum() + internalErrors.sum() + timeouts.sum() + aborted.sum();
        node.put("avg_latency_ms", finished == 0 ? 0.0 : (double) totalLatencyMillis.sum() / finished);
        node.put("connections_accepted", connectionsAccepted.sum());
        node.put("connections_rejected", connectionsRejected.sum());
        node.put("connections_closed", connectionsClosed.sum());
        node.put("oversized_messages", oversizedMessages.sum());
        return node;
    }
}
