package io.voxeldaemon.daemon.server;

import com.fasterxml.jackson.databind.node.NullNode;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.rpc.Dispatcher;
import io.voxeldaemon.core.rpc.RpcResponses;
import io.voxeldaemon.core.stats.DaemonStats;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns every client connection and the single selector thread
 * ({@code voxeld-io}) that accepts, reads and writes them.
 *
 * <p>
 * Frames are dispatched on the selector thread in arrival order. Workers hand
 * responses back through {@link Connection#deliver}, which wakes the selector
 * to flush. Failures of one connection close only that connection; a failing
 * selector is reported to the fatal error handler.
 */
public final class ConnectionManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    static final String MDC_CONNECTION = "connectionId";

    private static final long SELECT_TIMEOUT_MS = 250;
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    private final Dispatcher dispatcher;
    private final DaemonStats stats;
    private final Consumer<Throwable> fatalErrorHandler;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final Queue<Connection> flushRequests = new ConcurrentLinkedQueue<>();
    private final AtomicLong connectionSeq = new AtomicLong();
    private final ByteBuffer readBuffer = ByteBuffer.allocateDirect(READ_BUFFER_BYTES);

    private volatile ConnectionLimits limits;
    private volatile boolean running;
    private Selector selector;
    private SelectionKey acceptKey;
    private Thread ioThread;

    public ConnectionManager(ConnectionLimits limits, Dispatcher dispatcher, DaemonStats stats,
            Consumer<Throwable> fatalErrorHandler) {
        this.limits = limits;
        this.dispatcher = dispatcher;
        this.stats = stats;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    /** Registers the bound server channel and starts the selector thread. */
    public synchronized void start(ServerSocketChannel server) throws IOException {
        if (running) {
            throw new IllegalStateException("Connection manager already started");
        }
        selector = Selector.open();
        server.configureBlocking(false);
        acceptKey = server.register(selector, SelectionKey.OP_ACCEPT);
        running = true;
        ioThread = new Thread(this::runLoop, "voxeld-io");
        ioThread.start();
        LOG.info("Accepting connections (max {}, max message {} bytes, ordering {})",
                limits.maxConnections(), limits.maxMessageBytes(), limits.ordering().configValue());
    }

    /** Applies reloaded limits; existing connections keep their ordering policy. */
    public void applyLimits(ConnectionLimits newLimits) {
        this.limits = newLimits;
        for (Connection connection : connections.values()) {
            connection.framer().setMaxFrameBytes(newLimits.maxMessageBytes());
        }
    }

    public ConnectionLimits limits() {
        return limits;
    }

    public int connectionCount() {
        return connections.size();
    }

    /** Requests still being processed, over all connections. */
    public int inFlight() {
        int total = 0;
        for (Connection connection : connections.values()) {
            total += connection.inFlight();
        }
        return total;
    }

    /**
     * Stops accepting new connections. Returns once the selector no longer
     * watches the server channel, or after one second.
     */
    public void stopAccepting() {
        if (!running) {
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        submitTask(() -> {
            if (acceptKey != null) {
                acceptKey.cancel();
                acceptKey = null;
            }
            done.countDown();
        });
        try {
            if (!done.await(1, TimeUnit.SECONDS)) {
                LOG.warn("Selector did not confirm stop of accepting within 1000 ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Flushes queued responses and closes every connection, waiting at most
     * {@code flushTimeout}; then stops the selector thread.
     */
    public synchronized void shutdown(Duration flushTimeout) {
        if (selector == null || !selector.isOpen()) {
            return;
        }
        submitTask(() -> {
            for (Connection connection : new ArrayList<>(connections.values())) {
                beginClosing(connection);
            }
        });
        long deadline = System.nanoTime() + flushTimeout.toNanos();
        while (running && !connections.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!connections.isEmpty()) {
            LOG.warn("{} connection(s) still had unsent output after {} ms; closing them",
                    connections.size(), flushTimeout.toMillis());
        }
        running = false;
        selector.wakeup();
        try {
            ioThread.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Connection connection : new ArrayList<>(connections.values())) {
            closeConnection(connection, "shutdown");
        }
        try {
            selector.close();
        } catch (IOException e) {
            LOG.debug("Error closing selector: {}", e.getMessage());
        }
        LOG.info("Connection manager stopped");
    }

    // --- called from worker threads through Connection ---

    void requestFlush(Connection connection) {
        flushRequests.add(connection);
        Selector s = selector;
        if (s != null) {
            s.wakeup();
        }
    }

    // --- selector thread ---

    private void submitTask(Runnable task) {
        tasks.add(task);
        selector.wakeup();
    }

    private void runLoop() {
        try {
            while (running) {
                selector.select(SELECT_TIMEOUT_MS);
                runTasks();
                processFlushRequests();
                Iterator<SelectionKey> it = selector.selectedKeys().iterator();
                while (it.hasNext()) {
                    SelectionKey key = it.next();
                    it.remove();
                    handleKey(key);
                }
                sweepIdle();
            }
        } catch (IOException | ClosedSelectorException e) {
            if (running) {
                LOG.error("Selector loop failed", e);
                running = false;
                fatalErrorHandler.accept(e);
            }
        }
    }

    private void runTasks() {
        Runnable task;
        while ((task = tasks.poll()) != null) {
            task.run();
        }
    }

    private void processFlushRequests() {
        Connection connection;
        while ((connection = flushRequests.poll()) != null) {
            if (connection.state() != ConnectionState.CLOSED) {
                flush(connection);
            }
        }
    }

    private void handleKey(SelectionKey key) {
        if (!key.isValid()) {
            return;
        }
        if (key == acceptKey) {
            if (key.isAcceptable()) {
                accept((ServerSocketChannel) key.channel());
            }
            return;
        }
        Connection connection = (Connection) key.attachment();
        try {
            if (key.isValid() && key.isReadable()) {
                read(connection);
            }
            if (key.isValid() && key.isWritable()) {
                flush(connection);
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error on {}; closing it", connection.id(), e);
            closeConnection(connection, "internal error");
        }
    }

    private void accept(ServerSocketChannel server) {
        SocketChannel client;
        try {
            client = server.accept();
        } catch (IOException e) {
            LOG.warn("Accept failed: {}", e.getMessage());
            return;
        }
        if (client == null) {
            return;
        }
        ConnectionLimits current = limits;
        if (connections.size() >= current.maxConnections()) {
            rejectConnection(client, current.maxConnections());
            return;
        }
        String id = "conn-" + connectionSeq.incrementAndGet();
        Connection connection = new Connection(id, client, this, current.maxMessageBytes(), current.ordering());
        try {
            client.configureBlocking(false);
            SelectionKey key = client.register(selector, SelectionKey.OP_READ, connection);
            connection.attach(key);
        } catch (IOException e) {
            LOG.warn("Could not register connection {}: {}", id, e.getMessage());
            connection.close();
            return;
        }
        connections.put(id, connection);
        stats.connectionAccepted();
        LOG.info("Connection {} accepted ({} active)", id, connections.size());
    }

    private void rejectConnection(SocketChannel client, int max) {
        stats.connectionRejected();
        LOG.warn("Rejecting connection: {} connections already active", max);
        try (client) {
            byte[] line = (RpcResponses.error(NullNode.getInstance(), ErrorCode.TOO_MANY_CONNECTIONS,
                    "Too many connections (max " + max + ")").toString() + "\n").getBytes(StandardCharsets.UTF_8);
            client.write(ByteBuffer.wrap(line));
        } catch (IOException e) {
            LOG.debug("Could not notify rejected connection: {}", e.getMessage());
        }
    }

    private void read(Connection connection) {
        if (connection.state() != ConnectionState.ACTIVE) {
            return;
        }
        readBuffer.clear();
        int read;
        try {
            read = connection.channel().read(readBuffer);
        } catch (IOException e) {
            LOG.debug("Read failed on {}: {}", connection.id(), e.getMessage());
            closeConnection(connection, "read error");
            return;
        }
        if (read < 0) {
            closeConnection(connection, "peer closed");
            return;
        }
        if (read == 0) {
            return;
        }
        connection.touch();
        readBuffer.flip();
        MDC.put(MDC_CONNECTION, connection.id());
        try {
            connection.framer().feed(readBuffer, frame -> dispatcher.dispatch(frame, connection));
        } catch (FrameTooLargeException e) {
            stats.oversizedMessage();
            LOG.warn("Connection {} sent a frame over {} bytes; closing it", connection.id(), e.limit());
            connection.enqueueLine(RpcResponses.error(NullNode.getInstance(), ErrorCode.MESSAGE_TOO_LARGE,
                    e.getMessage()));
            beginClosing(connection);
        } finally {
            MDC.remove(MDC_CONNECTION);
        }
    }

    private void flush(Connection connection) {
        SelectionKey key = connection.key();
        try {
            boolean drained = connection.flush();
            if (drained && connection.state() == ConnectionState.CLOSING) {
                closeConnection(connection, "closed after flush");
                return;
            }
            if (key != null && key.isValid()) {
                int ops = key.interestOps();
                ops = drained ? ops & ~SelectionKey.OP_WRITE : ops | SelectionKey.OP_WRITE;
                if (connection.state() == ConnectionState.ACTIVE) {
                    ops = readInterest(connection, ops);
                }
                key.interestOps(ops);
            }
        } catch (IOException e) {
            LOG.debug("Write failed on {}: {}", connection.id(), e.getMessage());
            closeConnection(connection, "write error");
        }
    }

    /**
     * Stops reading from a client whose unread responses exceed the output cap
     * and resumes once the backlog has drained below half of it.
     */
    private int readInterest(Connection connection, int ops) {
        long cap = limits.maxPendingOutputBytes();
        long pending = connection.pendingOutputBytes();
        boolean reading = (ops & SelectionKey.OP_READ) != 0;
        if (reading && pending > cap) {
            LOG.debug("Connection {} has {} bytes of unread output; pausing reads", connection.id(), pending);
            return ops & ~SelectionKey.OP_READ;
        }
        if (!reading && pending <= cap / 2) {
            LOG.debug("Connection {} output drained; resuming reads", connection.id());
            return ops | SelectionKey.OP_READ;
        }
        return ops;
    }

    private void beginClosing(Connection connection) {
        if (connection.beginClosing()) {
            SelectionKey key = connection.key();
            if (key != null && key.isValid()) {
                key.interestOps(SelectionKey.OP_WRITE);
            }
            flush(connection);
        }
    }

    private void sweepIdle() {
        long timeout = limits.idleTimeoutMs();
        if (timeout <= 0) {
            return;
        }
        List<Connection> idle = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.state() == ConnectionState.ACTIVE && connection.inFlight() == 0
                    && !connection.hasPendingOutput() && connection.idleMillis() > timeout) {
                idle.add(connection);
            }
        }
        for (Connection connection : idle) {
            closeConnection(connection, "idle for more than " + timeout + " ms");
        }
    }

    private void closeConnection(Connection connection, String reason) {
        int abandoned = connection.inFlight();
        if (connection.close()) {
            connections.remove(connection.id());
            stats.connectionClosed();
            if (abandoned > 0) {
                LOG.info("Connection {} closed ({}); {} request(s) in flight abandoned", connection.id(), reason,
                        abandoned);
            } else {
                LOG.info("Connection {} closed ({})", connection.id(), reason);
            }
        }
    }
}
