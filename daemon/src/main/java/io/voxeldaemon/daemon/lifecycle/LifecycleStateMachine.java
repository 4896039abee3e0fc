package io.voxeldaemon.daemon.lifecycle;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daemon lifecycle as an explicit transition table.
 *
 * <pre>
 * INITIALIZING --STARTED--------------> RUNNING
 * INITIALIZING --STOP_REQUESTED-------> DRAINING
 * INITIALIZING --FATAL_ERROR----------> STOPPED
 * RUNNING      --RELOAD_REQUESTED-----> RUNNING
 * RUNNING      --CHILD_EXITED---------> RUNNING
 * RUNNING      --STOP_REQUESTED-------> DRAINING
 * RUNNING      --FATAL_ERROR----------> DRAINING
 * DRAINING     --CHILD_EXITED---------> DRAINING
 * DRAINING     --DRAIN_COMPLETE-------> STOPPED
 * </pre>
 *
 * Any other event is ignored and logged. Thread-safe; listeners run after the
 * state has changed, outside the machine's lock.
 */
public final class LifecycleStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(LifecycleStateMachine.class);

    private static final Map<LifecycleState, Map<LifecycleEvent, LifecycleState>> TABLE =
            new EnumMap<>(LifecycleState.class);

    static {
        allow(LifecycleState.INITIALIZING, LifecycleEvent.STARTED, LifecycleState.RUNNING);
        allow(LifecycleState.INITIALIZING, LifecycleEvent.STOP_REQUESTED, LifecycleState.DRAINING);
        allow(LifecycleState.INITIALIZING, LifecycleEvent.FATAL_ERROR, LifecycleState.STOPPED);
        allow(LifecycleState.RUNNING, LifecycleEvent.RELOAD_REQUESTED, LifecycleState.RUNNING);
        allow(LifecycleState.RUNNING, LifecycleEvent.CHILD_EXITED, LifecycleState.RUNNING);
        allow(LifecycleState.RUNNING, LifecycleEvent.STOP_REQUESTED, LifecycleState.DRAINING);
        allow(LifecycleState.RUNNING, LifecycleEvent.FATAL_ERROR, LifecycleState.DRAINING);
        allow(LifecycleState.DRAINING, LifecycleEvent.CHILD_EXITED, LifecycleState.DRAINING);
        allow(LifecycleState.DRAINING, LifecycleEvent.DRAIN_COMPLETE, LifecycleState.STOPPED);
    }

    private static void allow(LifecycleState from, LifecycleEvent event, LifecycleState to) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(LifecycleEvent.class)).put(event, to);
    }

    /**
     * An accepted transition. {@code from} equals {@code to} for events handled
     * in place, such as a reload.
     */
    public record Transition(LifecycleState from, LifecycleEvent event, LifecycleState to) {

        public boolean changesState() {
            return from != to;
        }
    }

    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private LifecycleState state = LifecycleState.INITIALIZING;

    public synchronized LifecycleState state() {
        return state;
    }

    public void addListener(LifecycleListener listener) {
        listeners.add(listener);
    }

    /**
     * Applies {@code event}.
     *
     * @return the transition, or empty if the event is not allowed in the
     *         current state
     */
    public Optional<Transition> fire(LifecycleEvent event) {
        Transition transition;
        synchronized (this) {
            LifecycleState target = TABLE.getOrDefault(state, Map.of()).get(event);
            if (target == null) {
                LOG.debug("Ignoring {} in state {}", event, state);
                return Optional.empty();
            }
            transition = new Transition(state, event, target);
            state = target;
            notifyAll();
        }
        if (transition.changesState()) {
            LOG.info("Lifecycle {} -> {} ({})", transition.from(), transition.to(), event);
        }
        for (LifecycleListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                LOG.error("Lifecycle listener failed on {}", transition, e);
            }
        }
        return Optional.of(transition);
    }

    /**
     * Waits until the machine is in {@code target} or a later state.
     *
     * @return {@code true} if reached within {@code timeout}
     */
    public synchronized boolean awaitState(LifecycleState target, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (state.ordinal() < target.ordinal()) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }
}
