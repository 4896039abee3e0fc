package io.voxeldaemon.core.engine;

import io.voxeldaemon.core.error.RequestTimeoutException;
import io.voxeldaemon.core.error.ShuttingDownException;
import io.voxeldaemon.core.registry.MutationClass;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole owner of the engine instance. Query-class operations share a read
 * lock; mutation-class operations take the write lock and therefore never
 * overlap with any other engine call. The lock is fair so a steady stream of
 * queries cannot starve a waiting mutation.
 */
public final class EngineGate implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EngineGate.class);

    public static final Duration DEFAULT_CLOSE_WAIT = Duration.ofSeconds(5);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final VoxelEngine engine;
    private final AtomicInteger activeReaders = new AtomicInteger();
    private volatile boolean mutating;
    private volatile boolean closed;
    private boolean engineClosed;

    public EngineGate(VoxelEngine engine) {
        this.engine = engine;
    }

    /** Runs {@code op} under the shared lock, waiting as long as needed. */
    public <T> T read(EngineOperation<T> op) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return runShared(op);
        } finally {
            readLock.unlock();
        }
    }

    /** Runs {@code op} under the exclusive lock, waiting as long as needed. */
    public <T> T write(EngineOperation<T> op) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return runExclusive(op);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs {@code op} under the lock matching {@code mutationClass}, waiting at
     * most {@code timeoutMillis} for it.
     *
     * @throws RequestTimeoutException if the lock is not acquired in time
     * @throws ShuttingDownException   if the gate has been closed
     * @throws InterruptedException    if the calling worker is interrupted while waiting
     */
    public <T> T access(MutationClass mutationClass, long timeoutMillis, EngineOperation<T> op)
            throws InterruptedException {
        boolean exclusive = mutationClass == MutationClass.MUTATION;
        Lock target = exclusive ? lock.writeLock() : lock.readLock();
        if (!target.tryLock(Math.max(0, timeoutMillis), TimeUnit.MILLISECONDS)) {
            throw new RequestTimeoutException("Timed out waiting for engine access");
        }
        try {
            return exclusive ? runExclusive(op) : runShared(op);
        } finally {
            target.unlock();
        }
    }

    /** Number of query operations currently inside the gate. */
    public int activeReaders() {
        return activeReaders.get();
    }

    /** {@code true} while a mutation operation is inside the gate. */
    public boolean isMutating() {
        return mutating;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Closes the engine, waiting up to {@link #DEFAULT_CLOSE_WAIT} for running operations. */
    @Override
    public void close() {
        close(DEFAULT_CLOSE_WAIT);
    }

    /**
     * Refuses new accesses, waits up to {@code wait} for running operations to
     * leave, then closes the engine. If an operation is still stuck inside the
     * gate after that, the engine is left open and a warning is logged.
     * Idempotent.
     */
    public void close(Duration wait) {
        closed = true;
        Lock writeLock = lock.writeLock();
        boolean acquired;
        try {
            acquired = writeLock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            LOG.warn("Engine still in use after {} ms; leaving it open", wait.toMillis());
            return;
        }
        try {
            if (!engineClosed) {
                engineClosed = true;
                engine.close();
                LOG.info("Engine closed");
            }
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T runShared(EngineOperation<T> op) {
        ensureOpen();
        activeReaders.incrementAndGet();
        try {
            return op.apply(engine);
        } finally {
            activeReaders.decrementAndGet();
        }
    }

    private <T> T runExclusive(EngineOperation<T> op) {
        ensureOpen();
        mutating = true;
        try {
            return op.apply(engine);
        } finally {
            mutating = false;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ShuttingDownException("Engine is shut down");
        }
    }
}
