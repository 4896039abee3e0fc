package io.voxeldaemon.core.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.error.RpcException;
import io.voxeldaemon.core.registry.CallContext;
import io.voxeldaemon.core.registry.RegisteredMethod;
import io.voxeldaemon.core.rpc.RpcResponses;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One worker thread. Takes jobs from the pool's queue in FIFO order and runs
 * them through the engine gate.
 *
 * <p>
 * A worker that loses the race to answer its own job (to the watchdog or to
 * the shutdown path) has been retired and exits instead of taking more work.
 */
final class Worker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Worker.class);

    static final String MDC_CONNECTION = "connectionId";
    static final String MDC_METHOD = "rpcMethod";
    static final String MDC_ID = "rpcId";

    private final WorkerPool pool;
    private final String name;
    private final Thread thread;
    private final AtomicReference<Job> current = new AtomicReference<>();
    private volatile WorkerState state = WorkerState.IDLE;

    Worker(WorkerPool pool, String name) {
        this.pool = pool;
        this.name = name;
        this.thread = new Thread(this, name);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    String name() {
        return name;
    }

    WorkerState state() {
        return state;
    }

    Job currentJob() {
        return current.get();
    }

    /** Marks the worker retired and interrupts whatever it is doing. */
    void retire() {
        state = WorkerState.RETIRED;
        thread.interrupt();
    }

    void join(long millis) throws InterruptedException {
        thread.join(millis);
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    @Override
    public void run() {
        LOG.debug("{} started", name);
        try {
            loop();
        } catch (RuntimeException | Error e) {
            state = WorkerState.RETIRED;
            pool.workerDied(this, current.getAndSet(null), e);
        }
        state = WorkerState.RETIRED;
        LOG.debug("{} exited", name);
    }

    private void loop() {
        while (state != WorkerState.RETIRED) {
            Job job;
            try {
                job = pool.take();
            } catch (InterruptedException e) {
                if (state == WorkerState.RETIRED || pool.isStopping()) {
                    break;
                }
                continue;
            }
            current.set(job);
            state = WorkerState.BUSY;
            boolean answered = execute(job);
            current.set(null);
            Thread.interrupted();
            if (!answered) {
                // Someone else answered this job and retired us.
                break;
            }
            if (state != WorkerState.RETIRED) {
                state = WorkerState.IDLE;
            }
        }
    }

    private boolean execute(Job job) {
        RegisteredMethod method = job.method();
        MDC.put(MDC_CONNECTION, job.originId());
        MDC.put(MDC_METHOD, method.name());
        MDC.put(MDC_ID, job.isNotification() ? "-" : job.id().toString());
        try {
            job.markStarted();
            JsonNode response;
            JobOutcome outcome;
            try {
                JsonNode result = pool.gate().access(method.mutationClass(), pool.requestTimeoutBudget(),
                        engine -> method.handler().handle(new CallContext(method, job.params(), engine,
                                job.registry())));
                response = RpcResponses.result(job.id(), result);
                outcome = JobOutcome.SUCCEEDED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                response = RpcResponses.error(job.id(), ErrorCode.REQUEST_TIMEOUT);
                outcome = JobOutcome.TIMED_OUT;
            } catch (RpcException e) {
                if (job.isNotification()) {
                    LOG.warn("Notification {} failed: {} {}", method.name(), e.code(), e.getMessage());
                } else {
                    LOG.debug("{} failed: {} {}", method.name(), e.code(), e.getMessage());
                }
                response = RpcResponses.error(job.id(), e);
                outcome = JobOutcome.FAILED;
            } catch (Exception e) {
                LOG.error("Unexpected failure in {}", method.name(), e);
                response = RpcResponses.error(job.id(), ErrorCode.INTERNAL_ERROR);
                outcome = JobOutcome.INTERNAL_ERROR;
            } catch (Error e) {
                LOG.error("Fatal error in {}", method.name(), e);
                response = RpcResponses.error(job.id(), ErrorCode.INTERNAL_ERROR);
                outcome = JobOutcome.INTERNAL_ERROR;
            }
            boolean answered = pool.answer(job, response, outcome);
            if (!answered) {
                LOG.info("Late result of {} discarded; job was already answered", method.name());
            }
            return answered;
        } finally {
            MDC.remove(MDC_CONNECTION);
            MDC.remove(MDC_METHOD);
            MDC.remove(MDC_ID);
        }
    }
}
