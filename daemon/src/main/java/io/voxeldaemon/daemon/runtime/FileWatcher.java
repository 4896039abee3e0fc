package io.voxeldaemon.daemon.runtime;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches the configuration file for changes.
 *
 * <p>
 * The file's directory is registered with a {@link WatchService}; events for
 * other files in it are ignored. A change fires {@code onChange} once the file
 * has been quiet for the debounce period, so an editor's burst of writes
 * causes one reload.
 *
 * <p>
 * Thread-safe. {@code onChange} runs on the {@code config-watcher-debounce}
 * thread.
 */
public final class FileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path file;
    private final Path fileName;
    private final int debounceMs;
    private final Runnable onChange;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread watchThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pendingReload;

    /**
     * @param file       configuration file to watch
     * @param debounceMs quiet period before {@code onChange} runs
     * @param onChange   invoked after a debounced change
     */
    public FileWatcher(Path file, int debounceMs, Runnable onChange) {
        this.file = file.toAbsolutePath();
        this.fileName = this.file.getFileName();
        this.debounceMs = debounceMs;
        this.onChange = onChange;
    }

    /**
     * Starts watching on a daemon thread.
     *
     * @throws IOException if the directory cannot be registered
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("Watcher for {} already running", file);
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher-debounce");
            t.setDaemon(true);
            return t;
        });
        try {
            file.getParent().register(
                    watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            stop();
            throw e;
        }
        watchThread = new Thread(this::pollLoop, "config-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        LOG.info("Watching {} for changes (debounce={}ms)", file, debounceMs);
    }

    /** Stops watching and releases the watch service. Idempotent. */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            if (watchService != null) {
                watchService.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing WatchService", e);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        LOG.info("Stopped watching {}", file);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    changed = true; // events were lost
                } else if (fileName.equals(event.context())) {
                    LOG.debug("{} changed ({})", fileName, event.kind().name());
                    changed = true;
                }
            }
            if (!key.reset()) {
                LOG.warn("Watch key for {} no longer valid (directory deleted?)", file.getParent());
            }
            if (changed) {
                scheduleReload();
            }
        }
    }

    private synchronized void scheduleReload() {
        if (pendingReload != null && !pendingReload.isDone()) {
            pendingReload.cancel(false);
        }
        pendingReload = scheduler.schedule(
                () -> {
                    try {
                        onChange.run();
                    } catch (RuntimeException e) {
                        LOG.error("Reload after change of {} failed", file, e);
                    }
                },
                debounceMs,
                TimeUnit.MILLISECONDS);
    }
}
