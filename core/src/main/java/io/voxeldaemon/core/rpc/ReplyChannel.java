package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The originating side of a request: a client connection that can receive
 * responses. Implemented by the daemon's connection type; core code only ever
 * holds it through a {@link java.lang.ref.WeakReference}.
 *
 * <p>
 * Every response-bearing request reserves a sequence number at dispatch time,
 * in arrival order. The channel decides whether to write responses as they
 * complete or to resequence them into reservation order.
 */
public interface ReplyChannel {

    /** Identifier used in logs and MDC. */
    String id();

    /** {@code false} once the connection is closing or closed. */
    boolean isOpen();

    /** Reserves the next response sequence number. Called on the dispatching thread. */
    long reserveSequence();

    /**
     * Delivers the payload reserved under {@code sequence}.
     *
     * @param sequence a number obtained from {@link #reserveSequence()}
     * @param payload  response object or batch array; {@code null} releases the
     *                 sequence without writing anything
     * @return {@code true} if the payload was queued for writing, {@code false}
     *         if the channel is closed and the payload was discarded
     */
    boolean deliver(long sequence, JsonNode payload);

    /** A job originating from this channel entered the worker pool. */
    void jobStarted();

    /** A job originating from this channel reached its final outcome. */
    void jobFinished();
}
