package io.voxeldaemon.core.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.registry.MethodRegistry;
import io.voxeldaemon.core.registry.Params;
import io.voxeldaemon.core.registry.RegisteredMethod;
import io.voxeldaemon.core.rpc.ReplyChannel;
import io.voxeldaemon.core.rpc.ResponseSlot;
import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A validated request waiting for, or running on, a worker.
 *
 * <p>
 * A job is answered exactly once. The worker, the timeout watchdog and the
 * shutdown path all race through {@link #claim()}; only the winner fills the
 * response slot.
 */
public final class Job {

    private final RegisteredMethod method;
    private final Params params;
    private final JsonNode id;
    private final MethodRegistry registry;
    private final ResponseSlot slot;
    private final WeakReference<ReplyChannel> origin;
    private final String originId;
    private final long enqueuedNanos;
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile long startedNanos;

    /**
     * @param method   resolved method
     * @param params   bound, validated params
     * @param id       request id, or {@code null} for a notification
     * @param registry registry the method came from
     * @param slot     where the response goes; {@link ResponseSlot#SILENT} for notifications
     * @param origin   connection the request arrived on
     */
    public Job(RegisteredMethod method, Params params, JsonNode id, MethodRegistry registry, ResponseSlot slot,
            ReplyChannel origin) {
        this.method = method;
        this.params = params;
        this.id = id;
        this.registry = registry;
        this.slot = slot;
        this.origin = new WeakReference<>(origin);
        this.originId = origin.id();
        this.enqueuedNanos = System.nanoTime();
    }

    public RegisteredMethod method() {
        return method;
    }

    public Params params() {
        return params;
    }

    /** Request id, or {@code null} for notifications. */
    public JsonNode id() {
        return id;
    }

    public boolean isNotification() {
        return id == null || id.isNull();
    }

    public MethodRegistry registry() {
        return registry;
    }

    public ResponseSlot slot() {
        return slot;
    }

    /** Id of the originating connection; still valid after the connection is gone. */
    public String originId() {
        return originId;
    }

    /** The originating connection, or {@code null} once it has been collected. */
    public ReplyChannel origin() {
        return origin.get();
    }

    public long enqueuedNanos() {
        return enqueuedNanos;
    }

    /** Start of execution, or {@code 0} while still queued. */
    public long startedNanos() {
        return startedNanos;
    }

    void markStarted() {
        startedNanos = System.nanoTime();
    }

    /** Wins the right to answer this job. Returns {@code false} if someone else already did. */
    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    boolean isClaimed() {
        return claimed.get();
    }

    @Override
    public String toString() {
        return "Job[" + method.name() + ", id=" + id + ", conn=" + originId + "]";
    }
}
