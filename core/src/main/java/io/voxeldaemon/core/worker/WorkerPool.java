package io.voxeldaemon.core.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.engine.EngineGate;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.error.ServerBusyException;
import io.voxeldaemon.core.error.ShuttingDownException;
import io.voxeldaemon.core.rpc.Delivery;
import io.voxeldaemon.core.rpc.ReplyChannel;
import io.voxeldaemon.core.rpc.RpcResponses;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of worker threads fed from one bounded FIFO queue.
 *
 * <p>
 * Submission never blocks: a full queue is reported as
 * {@link ServerBusyException}. A watchdog answers jobs that exceed the
 * request timeout with {@code -32001}, retires the stuck worker and starts a
 * replacement, so the number of workers taking new jobs stays constant.
 *
 * <p>
 * Thread-safe.
 */
public final class WorkerPool implements JobSink {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerPoolConfig config;
    private final EngineGate gate;
    private final JobListener listener;
    private final BlockingQueue<Job> queue;
    private final List<Worker> workers = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final AtomicInteger pending = new AtomicInteger();
    private final Object quiescence = new Object();
    private final ScheduledExecutorService watchdog;

    private volatile long requestTimeoutMs;
    private volatile boolean started;
    private volatile boolean accepting;
    private volatile boolean stopping;

    public WorkerPool(WorkerPoolConfig config, EngineGate gate, JobListener listener) {
        this.config = config;
        this.gate = gate;
        this.listener = listener == null ? JobListener.NOOP : listener;
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
        this.requestTimeoutMs = config.requestTimeoutMs();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voxeld-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /** Starts the workers and the watchdog. */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Worker pool already started");
        }
        started = true;
        accepting = true;
        for (int i = 0; i < config.workerCount(); i++) {
            spawnWorker();
        }
        watchdog.scheduleWithFixedDelay(
                this::checkTimeouts, config.watchdogPeriodMs(), config.watchdogPeriodMs(), TimeUnit.MILLISECONDS);
        LOG.info("Worker pool started: {} workers, queue capacity {}, request timeout {} ms",
                config.workerCount(), config.queueCapacity(), requestTimeoutMs);
    }

    @Override
    public void submit(Job job) {
        if (!accepting) {
            listener.jobRejected(job, ErrorCode.SHUTTING_DOWN);
            throw new ShuttingDownException("Server shutting down");
        }
        ReplyChannel origin = job.origin();
        pending.incrementAndGet();
        if (origin != null) {
            origin.jobStarted();
        }
        if (!queue.offer(job)) {
            if (origin != null) {
                origin.jobFinished();
            }
            release();
            listener.jobRejected(job, ErrorCode.SERVER_BUSY);
            throw new ServerBusyException(config.queueCapacity());
        }
        listener.jobAccepted(job);
    }

    /** Updates the execution budget for jobs that start from now on. */
    public void setRequestTimeoutMs(long requestTimeoutMs) {
        if (requestTimeoutMs < 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be >= 0");
        }
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long requestTimeoutMs() {
        return requestTimeoutMs;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public int queueDepth() {
        return queue.size();
    }

    public int queueCapacity() {
        return config.queueCapacity();
    }

    /** Workers currently taking jobs, excluding retired ones still unwinding. */
    public int workerCount() {
        int count = 0;
        for (Worker worker : workers) {
            if (worker.state() != WorkerState.RETIRED && worker.isAlive()) {
                count++;
            }
        }
        return count;
    }

    public int busyWorkers() {
        int count = 0;
        for (Worker worker : workers) {
            if (worker.state() == WorkerState.BUSY && worker.isAlive()) {
                count++;
            }
        }
        return count;
    }

    /** Jobs accepted but not yet answered. */
    public int pendingJobs() {
        return pending.get();
    }

    /**
     * Stops accepting work, waits up to {@code grace} for accepted jobs to be
     * answered, then answers everything left with {@code -32002} and stops the
     * threads.
     *
     * @return {@code true} if every job finished within the grace period
     */
    public boolean shutdown(Duration grace) {
        accepting = false;
        boolean drained = awaitQuiescence(grace);
        stopping = true;
        if (!drained) {
            LOG.warn("Shutdown grace of {} ms elapsed with {} job(s) unanswered", grace.toMillis(), pending.get());
            List<Job> leftovers = new ArrayList<>();
            queue.drainTo(leftovers);
            for (Job job : leftovers) {
                answer(job, RpcResponses.error(job.id(), ErrorCode.SHUTTING_DOWN), JobOutcome.ABORTED);
            }
            for (Worker worker : workers) {
                Job job = worker.currentJob();
                if (job != null) {
                    answer(job, RpcResponses.error(job.id(), ErrorCode.SHUTTING_DOWN), JobOutcome.ABORTED);
                }
            }
        }
        watchdog.shutdownNow();
        for (Worker worker : workers) {
            worker.retire();
        }
        for (Worker worker : workers) {
            try {
                worker.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (worker.isAlive()) {
                LOG.warn("{} did not exit within 1000 ms", worker.name());
            }
        }
        LOG.info("Worker pool stopped (drained={})", drained);
        return drained;
    }

    // --- package-private hooks used by Worker ---

    Job take() throws InterruptedException {
        return queue.take();
    }

    boolean isStopping() {
        return stopping;
    }

    EngineGate gate() {
        return gate;
    }

    long requestTimeoutBudget() {
        long timeout = requestTimeoutMs;
        return timeout == 0 ? Long.MAX_VALUE : timeout;
    }

    /**
     * Answers {@code job} if nobody has yet.
     *
     * @return {@code false} if the job had already been answered
     */
    boolean answer(Job job, JsonNode response, JobOutcome outcome) {
        if (!job.claim()) {
            return false;
        }
        Delivery delivery;
        try {
            delivery = job.slot().fill(response);
        } finally {
            ReplyChannel origin = job.origin();
            if (origin != null) {
                origin.jobFinished();
            }
            release();
        }
        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - job.enqueuedNanos());
        listener.jobCompleted(job, outcome, delivery, durationMillis);
        if (delivery == Delivery.DISCARDED) {
            LOG.debug("Response for {} discarded; connection {} is closed", job, job.originId());
        }
        return true;
    }

    /**
     * Called by a worker whose thread is about to die from a failure outside
     * the handler boundary: answers its job and starts a replacement.
     */
    void workerDied(Worker worker, Job job, Throwable cause) {
        LOG.error("{} died unexpectedly", worker.name(), cause);
        if (job != null) {
            try {
                answer(job, RpcResponses.error(job.id(), ErrorCode.INTERNAL_ERROR), JobOutcome.INTERNAL_ERROR);
            } catch (RuntimeException e) {
                LOG.error("Could not answer {} after {} died", job, worker.name(), e);
            }
        }
        if (workers.remove(worker) && !stopping) {
            listener.workerReplaced(worker.name(), spawnWorker());
        }
    }

    // --- internals ---

    private String spawnWorker() {
        Worker worker = new Worker(this, "voxeld-worker-" + workerSeq.incrementAndGet());
        workers.add(worker);
        worker.start();
        return worker.name();
    }

    private void release() {
        if (pending.decrementAndGet() == 0) {
            synchronized (quiescence) {
                quiescence.notifyAll();
            }
        }
    }

    private boolean awaitQuiescence(Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        synchronized (quiescence) {
            while (pending.get() > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                try {
                    quiescence.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return pending.get() == 0;
                }
            }
        }
        return true;
    }

    private void checkTimeouts() {
        long timeout = requestTimeoutMs;
        if (timeout == 0 || stopping) {
            return;
        }
        long now = System.nanoTime();
        for (Worker worker : workers) {
            Job job = worker.currentJob();
            if (job == null || job.startedNanos() == 0) {
                continue;
            }
            if (TimeUnit.NANOSECONDS.toMillis(now - job.startedNanos()) < timeout) {
                continue;
            }
            JsonNode response = RpcResponses.error(job.id(), ErrorCode.REQUEST_TIMEOUT,
                    "Request timeout: " + job.method().name() + " exceeded " + timeout + " ms");
            if (answer(job, response, JobOutcome.TIMED_OUT)) {
                LOG.warn("{} exceeded {} ms on {}; retiring worker", job, timeout, worker.name());
                worker.retire();
                workers.remove(worker);
                if (!stopping) {
                    listener.workerReplaced(worker.name(), spawnWorker());
                }
            }
        }
    }
}
