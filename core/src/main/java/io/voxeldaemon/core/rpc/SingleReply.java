package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicBoolean;

/** Response slot for a single (non-batch) request. */
public final class SingleReply implements ResponseSlot {

    private final WeakReference<ReplyChannel> channel;
    private final long sequence;
    private final AtomicBoolean filled = new AtomicBoolean(false);

    /** Reserves the next sequence on {@code channel}. Must run on the dispatching thread. */
    public SingleReply(ReplyChannel channel) {
        this.channel = new WeakReference<>(channel);
        this.sequence = channel.reserveSequence();
    }

    @Override
    public Delivery fill(JsonNode response) {
        if (!filled.compareAndSet(false, true)) {
            return Delivery.DUPLICATE;
        }
        ReplyChannel target = channel.get();
        if (target == null) {
            return Delivery.DISCARDED;
        }
        return target.deliver(sequence, response) ? Delivery.DELIVERED : Delivery.DISCARDED;
    }

    @Override
    public boolean isAbandoned() {
        ReplyChannel target = channel.get();
        return target == null || !target.isOpen();
    }
}
