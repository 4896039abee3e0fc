package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Collects the responses of a batch. Elements complete in any order; the
 * combined array is written once, with each response at the position of its
 * request among the response-bearing elements of the batch.
 */
public final class BatchReply {

    private final WeakReference<ReplyChannel> channel;
    private final long sequence;
    private final AtomicReferenceArray<JsonNode> responses;
    private final AtomicInteger remaining;

    /**
     * @param channel originating connection; one sequence is reserved for the
     *                whole batch
     * @param size    number of response-bearing elements, at least one
     */
    public BatchReply(ReplyChannel channel, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("batch reply needs at least one slot");
        }
        this.channel = new WeakReference<>(channel);
        this.sequence = channel.reserveSequence();
        this.responses = new AtomicReferenceArray<>(size);
        this.remaining = new AtomicInteger(size);
    }

    /** Number of positions in the combined response. */
    public int size() {
        return responses.length();
    }

    /** Returns the slot for the response at {@code position}. */
    public ResponseSlot slot(int position) {
        if (position < 0 || position >= responses.length()) {
            throw new IndexOutOfBoundsException("batch position " + position);
        }
        return new ResponseSlot() {
            @Override
            public Delivery fill(JsonNode response) {
                return complete(position, response);
            }

            @Override
            public boolean isAbandoned() {
                ReplyChannel target = channel.get();
                return target == null || !target.isOpen();
            }
        };
    }

    private Delivery complete(int position, JsonNode response) {
        if (!responses.compareAndSet(position, null, response)) {
            return Delivery.DUPLICATE;
        }
        if (remaining.decrementAndGet() > 0) {
            return Delivery.PENDING;
        }
        ArrayNode combined = JsonNodeFactory.instance.arrayNode(responses.length());
        for (int i = 0; i < responses.length(); i++) {
            combined.add(responses.get(i));
        }
        ReplyChannel target = channel.get();
        if (target == null) {
            return Delivery.DISCARDED;
        }
        return target.deliver(sequence, combined) ? Delivery.DELIVERED : Delivery.DISCARDED;
    }
}
