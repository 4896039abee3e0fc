package io.voxeldaemon.daemon.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.voxeldaemon.core.rpc.ReplyChannel;
import io.voxeldaemon.daemon.config.ResponseOrdering;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One client connection.
 *
 * <p>
 * Reads, writes and closing happen on the I/O thread. Workers only call
 * {@link #deliver}, which serializes the response, appends it to the outbound
 * queue and asks the {@link ConnectionManager} to flush.
 */
public final class Connection implements ReplyChannel {

    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);

    private static final ObjectWriter WRITER = new ObjectMapper().writer();

    private final String id;
    private final SocketChannel channel;
    private final ConnectionManager manager;
    private final LineFramer framer;
    private final ResponseSequencer sequencer;
    private final Queue<ByteBuffer> outbound = new ConcurrentLinkedQueue<>();
    private final Object outputLock = new Object();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong pendingOutputBytes = new AtomicLong();
    private final Instant createdAt = Instant.now();
    private volatile long lastActivityNanos = System.nanoTime();
    private SelectionKey key;

    Connection(String id, SocketChannel channel, ConnectionManager manager, int maxFrameBytes,
            ResponseOrdering ordering) {
        this.id = id;
        this.channel = channel;
        this.manager = manager;
        this.framer = new LineFramer(maxFrameBytes);
        this.sequencer = new ResponseSequencer(ordering);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return state.get() == ConnectionState.ACTIVE;
    }

    public ConnectionState state() {
        return state.get();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public ResponseOrdering ordering() {
        return sequencer.ordering();
    }

    @Override
    public long reserveSequence() {
        return sequencer.reserve();
    }

    @Override
    public boolean deliver(long sequence, JsonNode payload) {
        if (!isOpen()) {
            return false;
        }
        boolean queued = false;
        // A later release must never reach the queue before an earlier one.
        synchronized (outputLock) {
            for (JsonNode response : sequencer.complete(sequence, payload)) {
                try {
                    enqueue(WRITER.writeValueAsBytes(response));
                    queued = true;
                } catch (JsonProcessingException e) {
                    LOG.error("Failed to serialize response on {}", id, e);
                }
            }
        }
        if (state.get() == ConnectionState.CLOSED) {
            discardOutput();
            return false;
        }
        if (queued) {
            manager.requestFlush(this);
        }
        return true;
    }

    @Override
    public void jobStarted() {
        inFlight.incrementAndGet();
    }

    @Override
    public void jobFinished() {
        inFlight.decrementAndGet();
        touch();
    }

    @Override
    public String toString() {
        return id;
    }

    // --- I/O thread side ---

    SocketChannel channel() {
        return channel;
    }

    LineFramer framer() {
        return framer;
    }

    void attach(SelectionKey key) {
        this.key = key;
        state.set(ConnectionState.ACTIVE);
    }

    SelectionKey key() {
        return key;
    }

    void touch() {
        lastActivityNanos = System.nanoTime();
    }

    long idleMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastActivityNanos);
    }

    boolean hasPendingOutput() {
        return !outbound.isEmpty();
    }

    /** Bytes queued for this client and not yet written to the socket. */
    long pendingOutputBytes() {
        return pendingOutputBytes.get();
    }

    /** Queues a pre-built line that bypasses sequencing, such as a transport error. */
    void enqueueLine(JsonNode response) {
        try {
            enqueue(WRITER.writeValueAsBytes(response));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize transport error on {}", id, e);
        }
    }

    private void enqueue(byte[] json) {
        ByteBuffer buffer = ByteBuffer.allocate(json.length + 1);
        buffer.put(json).put((byte) '\n').flip();
        pendingOutputBytes.addAndGet(buffer.remaining());
        outbound.add(buffer);
    }

    private void discardOutput() {
        ByteBuffer buffer;
        while ((buffer = outbound.poll()) != null) {
            pendingOutputBytes.addAndGet(-buffer.remaining());
        }
    }

    /**
     * Writes as much queued output as the socket takes.
     *
     * @return {@code true} if the queue is now empty
     */
    boolean flush() throws IOException {
        ByteBuffer head;
        while ((head = outbound.peek()) != null) {
            int written = channel.write(head);
            pendingOutputBytes.addAndGet(-written);
            if (head.hasRemaining()) {
                return false;
            }
            outbound.poll();
            touch();
        }
        return true;
    }

    /** Stops reading; the connection closes once its queued output is written. */
    boolean beginClosing() {
        return state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.CLOSING)
                || state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSING);
    }

    /**
     * Closes the channel. Responses completed later are discarded.
     *
     * @return {@code false} if the connection was already closed
     */
    boolean close() {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
            return false;
        }
        if (key != null) {
            key.cancel();
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", id, e.getMessage());
        }
        discardOutput();
        return true;
    }
}
