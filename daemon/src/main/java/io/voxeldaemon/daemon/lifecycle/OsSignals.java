package io.voxeldaemon.daemon.lifecycle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Bridges OS signals to lifecycle events: TERM and INT request a stop, HUP a
 * reload.
 *
 * <p>
 * {@code sun.misc.Signal} is exported by the {@code jdk.unsupported} module.
 * A signal the platform refuses is skipped; the caller's JVM shutdown hook
 * stays the stop path of last resort. Handlers run on a JVM signal thread and
 * must return quickly.
 */
public final class OsSignals implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(OsSignals.class);

    private final Map<String, SignalHandler> previous = new LinkedHashMap<>();

    private OsSignals() {}

    /**
     * Installs the handlers.
     *
     * @param onStop   run for TERM and INT
     * @param onReload run for HUP
     * @return the installed bridge; {@link #installed()} lists the signals actually handled
     */
    public static OsSignals install(Runnable onStop, Runnable onReload) {
        OsSignals signals = new OsSignals();
        signals.register("TERM", onStop);
        signals.register("INT", onStop);
        signals.register("HUP", onReload);
        return signals;
    }

    /** Names of the signals that now have a handler. */
    public List<String> installed() {
        return new ArrayList<>(previous.keySet());
    }

    private void register(String name, Runnable action) {
        SignalHandler handler = signal -> {
            LOG.info("Received SIG{}", signal.getName());
            action.run();
        };
        try {
            previous.put(name, Signal.handle(new Signal(name), handler));
            LOG.debug("Installed handler for SIG{}", name);
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot handle SIG{} on this platform: {}", name, e.getMessage());
        }
    }

    /** Restores the handlers that were in place before {@link #install}. */
    @Override
    public void close() {
        for (Map.Entry<String, SignalHandler> entry : previous.entrySet()) {
            try {
                Signal.handle(new Signal(entry.getKey()), entry.getValue());
            } catch (IllegalArgumentException e) {
                LOG.debug("Could not restore handler for SIG{}: {}", entry.getKey(), e.getMessage());
            }
        }
        previous.clear();
    }
}
