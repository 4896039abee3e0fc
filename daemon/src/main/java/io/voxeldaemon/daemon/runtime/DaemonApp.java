package io.voxeldaemon.daemon.runtime;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.engine.EngineGate;
import io.voxeldaemon.core.engine.InMemoryVoxelEngine;
import io.voxeldaemon.core.methods.BuiltinMethods;
import io.voxeldaemon.core.methods.DaemonVersion;
import io.voxeldaemon.core.registry.MethodRegistry;
import io.voxeldaemon.core.rpc.Dispatcher;
import io.voxeldaemon.core.stats.DaemonStats;
import io.voxeldaemon.core.worker.WorkerPool;
import io.voxeldaemon.core.worker.WorkerPoolConfig;
import io.voxeldaemon.daemon.config.CommandLineOptions;
import io.voxeldaemon.daemon.config.ConfigLoadException;
import io.voxeldaemon.daemon.config.ConfigLoader;
import io.voxeldaemon.daemon.config.DaemonConfig;
import io.voxeldaemon.daemon.lifecycle.ChildProcessReaper;
import io.voxeldaemon.daemon.lifecycle.DaemonStartupException;
import io.voxeldaemon.daemon.lifecycle.LifecycleEvent;
import io.voxeldaemon.daemon.lifecycle.LifecycleState;
import io.voxeldaemon.daemon.lifecycle.LifecycleStateMachine;
import io.voxeldaemon.daemon.lifecycle.PidFile;
import io.voxeldaemon.daemon.server.ConnectionLimits;
import io.voxeldaemon.daemon.server.ConnectionManager;
import io.voxeldaemon.daemon.server.SocketListener;
import java.io.IOException;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The running daemon: wires configuration, pid file, engine gate, worker
 * pool, dispatcher, listener and connection manager, and drives them through
 * the lifecycle.
 *
 * <p>
 * Startup happens in INITIALIZING; any failure releases what was acquired
 * and surfaces as {@link DaemonStartupException} (or
 * {@link ConfigLoadException}). A stop request moves to DRAINING, which runs
 * on its own thread and ends in STOPPED.
 */
public final class DaemonApp {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonApp.class);

    static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(2);
    static final Duration CHILD_GRACE = Duration.ofSeconds(1);

    private final Supplier<DaemonConfig> configSource;
    private final Path configPath;
    private final LifecycleStateMachine lifecycle = new LifecycleStateMachine();
    private final DaemonStats stats = new DaemonStats();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong reloads = new AtomicLong();

    private volatile DaemonConfig config;
    private volatile int exitCode;

    private PidFile pidFile;
    private ChildProcessReaper reaper;
    private EngineGate gate;
    private WorkerPool pool;
    private SocketListener listener;
    private ConnectionManager connections;
    private FileWatcher watcher;
    private MethodRegistry registry;

    private DaemonApp(DaemonConfig config, Path configPath, Supplier<DaemonConfig> configSource) {
        this.config = config;
        this.configPath = configPath;
        this.configSource = configSource;
    }

    /**
     * Starts the daemon from command line arguments: loads the configuration,
     * configures logging and brings the daemon to RUNNING.
     *
     * @throws ConfigLoadException     if the configuration is missing or invalid
     * @throws DaemonStartupException  if the daemon cannot start
     * @throws IllegalArgumentException on unknown arguments
     */
    public static DaemonApp start(String[] args) {
        CommandLineOptions options = CommandLineOptions.parse(args);
        DaemonConfig config = ConfigLoader.load(options);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("voxel-daemon {} starting (config {})", DaemonVersion.VERSION, options.configPath());
        Path watched = options.explicitConfig() || Files.exists(options.configPath())
                ? options.configPath()
                : null;
        DaemonApp app = new DaemonApp(config, watched, () -> ConfigLoader.load(options));
        app.startup(builder -> {});
        return app;
    }

    /**
     * Starts the daemon from an already loaded configuration. Logging is left
     * as configured by the caller.
     *
     * @param configPath file re-read on reload, or {@code null} to keep
     *                   {@code config} across reloads
     * @param customizer registers additional methods
     */
    public static DaemonApp start(Path configPath, DaemonConfig config, Consumer<MethodRegistry.Builder> customizer) {
        Objects.requireNonNull(config, "config");
        Supplier<DaemonConfig> source = configPath == null ? () -> config : () -> ConfigLoader.load(configPath);
        DaemonApp app = new DaemonApp(config, configPath, source);
        app.startup(customizer);
        return app;
    }

    private void startup(Consumer<MethodRegistry.Builder> customizer) {
        lifecycle.addListener(transition -> {
            switch (transition.event()) {
                case RELOAD_REQUESTED -> reload();
                case CHILD_EXITED -> reaper.reap();
                default -> {
                    // other transitions are driven by this class directly
                }
            }
        });
        DaemonConfig cfg = config;
        try {
            pidFile = new PidFile(cfg.pidFilePath());
            pidFile.acquire();

            reaper = new ChildProcessReaper(() -> lifecycle.fire(LifecycleEvent.CHILD_EXITED));
            gate = new EngineGate(new InMemoryVoxelEngine(DaemonVersion.VERSION));
            registry = BuiltinMethods.registry(this::statusSnapshot, customizer);
            pool = new WorkerPool(new WorkerPoolConfig(cfg.workerCount(), cfg.queueSize(), cfg.requestTimeoutMs()),
                    gate, stats);
            pool.start();
            Dispatcher dispatcher = new Dispatcher(registry, pool, stats);

            listener = new SocketListener(cfg.socketFile(), cfg.socketPermissions());
            ServerSocketChannel server = listener.bind();
            connections = new ConnectionManager(ConnectionLimits.from(cfg), dispatcher, stats, this::fatalError);
            connections.start(server);

            if (cfg.reloadWatchConfig() && configPath != null) {
                watcher = new FileWatcher(configPath, cfg.reloadDebounceMs(), this::requestReload);
                watcher.start();
            }
        } catch (IOException | RuntimeException e) {
            LOG.debug("Startup aborted; releasing acquired resources", e);
            exitCode = 1;
            releaseResources();
            lifecycle.fire(LifecycleEvent.FATAL_ERROR);
            terminated.countDown();
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DaemonStartupException("Startup failed: " + e.getMessage(), e);
        }

        if (lifecycle.fire(LifecycleEvent.STARTED).isEmpty()) {
            LOG.info("Stop requested during startup");
            beginDrain();
            return;
        }
        LOG.info("voxel-daemon running: socket {}, {} workers, {} methods",
                cfg.socketPath(), cfg.workerCount(), registry.size());
        startReadyCommand(cfg);
    }

    private void startReadyCommand(DaemonConfig cfg) {
        if (!cfg.hasReadyCommand()) {
            return;
        }
        try {
            reaper.start(cfg.readyCommand());
        } catch (IOException e) {
            LOG.error("Could not start ready command '{}': {}", cfg.readyCommand(), e.getMessage());
        }
    }

    // --- lifecycle requests ---

    /** Moves to DRAINING and starts the drain. Safe to call from any thread, any number of times. */
    public void requestStop() {
        lifecycle.fire(LifecycleEvent.STOP_REQUESTED).ifPresent(transition -> {
            if (transition.from() == LifecycleState.RUNNING) {
                beginDrain();
            }
        });
    }

    /** Re-reads the configuration and applies its reloadable part. Ignored unless RUNNING. */
    public void requestReload() {
        lifecycle.fire(LifecycleEvent.RELOAD_REQUESTED);
    }

    /** Stops and waits for STOPPED. Idempotent. */
    public int stop() {
        requestStop();
        return awaitTermination();
    }

    /**
     * Blocks until STOPPED.
     *
     * @return process exit status: 0 after a requested stop, 1 after a fatal error
     */
    public int awaitTermination() {
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
        return exitCode;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void fatalError(Throwable cause) {
        LOG.error("Fatal runtime error; shutting down", cause);
        exitCode = 1;
        lifecycle.fire(LifecycleEvent.FATAL_ERROR).ifPresent(transition -> {
            if (transition.from() == LifecycleState.RUNNING) {
                beginDrain();
            }
        });
    }

    private void beginDrain() {
        Thread drain = new Thread(this::drain, "voxeld-drain");
        drain.start();
    }

    private void drain() {
        DaemonConfig cfg = config;
        LOG.info("Draining: {} job(s) pending, grace {} ms", pool.pendingJobs(), cfg.shutdownGraceMs());
        try {
            connections.stopAccepting();
            listener.close();
            boolean clean = pool.shutdown(Duration.ofMillis(cfg.shutdownGraceMs()));
            if (!clean) {
                LOG.warn("Jobs still running after the grace period were answered with -32002");
            }
            connections.shutdown(FLUSH_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.error("Error while draining", e);
            exitCode = 1;
        } finally {
            releaseResources();
            lifecycle.fire(LifecycleEvent.DRAIN_COMPLETE);
            terminated.countDown();
            LOG.info("voxel-daemon stopped");
        }
    }

    /** Releases in reverse acquisition order whatever exists. Each step is idempotent. */
    private void releaseResources() {
        if (watcher != null) {
            watcher.stop();
        }
        if (connections != null) {
            connections.shutdown(FLUSH_TIMEOUT);
        }
        if (listener != null) {
            listener.close();
        }
        if (pool != null && pool.isAccepting()) {
            pool.shutdown(Duration.ZERO);
        }
        if (gate != null) {
            gate.close();
        }
        if (reaper != null) {
            reaper.destroyAll(CHILD_GRACE);
        }
        if (pidFile != null) {
            pidFile.release();
        }
    }

    // --- reload ---

    private synchronized void reload() {
        DaemonConfig current = config;
        DaemonConfig loaded;
        try {
            loaded = configSource.get();
        } catch (ConfigLoadException e) {
            LOG.error("Reload failed; keeping the running configuration: {}", e.getMessage());
            return;
        }
        for (String ignored : restartOnlyChanges(current, loaded)) {
            LOG.warn("{} changed; the new value takes effect after a restart", ignored);
        }
        DaemonConfig applied = current.toBuilder()
                .requestTimeoutMs(loaded.requestTimeoutMs())
                .maxConnections(loaded.maxConnections())
                .maxMessageBytes(loaded.maxMessageBytes())
                .idleTimeoutMs(loaded.idleTimeoutMs())
                .maxPendingOutputBytes(loaded.maxPendingOutputBytes())
                .responseOrdering(loaded.responseOrdering())
                .shutdownGraceMs(loaded.shutdownGraceMs())
                .loggingFormat(loaded.loggingFormat())
                .loggingLevel(loaded.loggingLevel())
                .build();
        if (!applied.loggingFormat().equals(current.loggingFormat())
                || !applied.loggingLevel().equals(current.loggingLevel())) {
            LogbackConfigurator.configure(applied.loggingFormat(), applied.loggingLevel());
        }
        connections.applyLimits(ConnectionLimits.from(applied));
        pool.setRequestTimeoutMs(applied.requestTimeoutMs());
        config = applied;
        reloads.incrementAndGet();
        LOG.info("Configuration reloaded");
    }

    static List<String> restartOnlyChanges(DaemonConfig current, DaemonConfig loaded) {
        List<String> changed = new ArrayList<>();
        if (!current.socketPath().equals(loaded.socketPath())) {
            changed.add("socket.path");
        }
        if (!current.socketPermissions().equals(loaded.socketPermissions())) {
            changed.add("socket.permissions");
        }
        if (!current.pidFile().equals(loaded.pidFile())) {
            changed.add("process.pid-file");
        }
        if (!current.readyCommand().equals(loaded.readyCommand())) {
            changed.add("process.ready-command");
        }
        if (current.workerCount() != loaded.workerCount()) {
            changed.add("worker.count");
        }
        if (current.queueSize() != loaded.queueSize()) {
            changed.add("worker.queue-size");
        }
        if (current.reloadWatchConfig() != loaded.reloadWatchConfig()
                || current.reloadDebounceMs() != loaded.reloadDebounceMs()) {
            changed.add("reload");
        }
        return changed;
    }

    // --- status ---

    private ObjectNode statusSnapshot() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("state", lifecycle.state().label());
        node.put("pid", ProcessHandle.current().pid());
        node.put("version", DaemonVersion.VERSION);
        node.put("uptime_seconds", stats.uptimeSeconds());
        node.put("socket_path", config.socketPath());
        node.put("connections", connections == null ? 0 : connections.connectionCount());
        node.put("max_connections", config.maxConnections());
        node.put("queue_depth", pool.queueDepth());
        node.put("queue_capacity", pool.queueCapacity());
        node.put("workers", pool.workerCount());
        node.put("busy_workers", pool.busyWorkers());
        node.put("response_ordering", config.responseOrdering().configValue());
        node.put("reloads", reloads.get());
        node.set("counters", stats.toJson());
        return node;
    }

    // --- accessors ---

    public LifecycleState state() {
        return lifecycle.state();
    }

    public LifecycleStateMachine lifecycle() {
        return lifecycle;
    }

    public DaemonConfig config() {
        return config;
    }

    public DaemonStats stats() {
        return stats;
    }

    public MethodRegistry registry() {
        return registry;
    }

    public Path socketPath() {
        return listener.path();
    }

    public int connectionCount() {
        return connections.connectionCount();
    }

    public long reloadCount() {
        return reloads.get();
    }

    public int activeChildren() {
        return reaper.size();
    }
}
