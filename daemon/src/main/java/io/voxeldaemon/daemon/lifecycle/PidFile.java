package io.voxeldaemon.daemon.lifecycle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The instance-identity file: the daemon's decimal pid followed by a newline.
 *
 * <p>
 * {@link #acquire()} refuses to start when the file names another live
 * process. A file naming a dead process, or holding garbage, is stale and is
 * overwritten. Within one JVM, a path is also held by at most one
 * {@code PidFile} at a time, so embedded daemons sharing a process cannot
 * claim the same file.
 */
public final class PidFile {

    private static final Logger LOG = LoggerFactory.getLogger(PidFile.class);

    private static final Set<Path> HELD_IN_THIS_JVM = ConcurrentHashMap.newKeySet();

    private final Path path;
    private final long pid;
    private boolean held;

    public PidFile(Path path) {
        this(path, ProcessHandle.current().pid());
    }

    PidFile(Path path, long pid) {
        this.path = path.toAbsolutePath();
        this.pid = pid;
    }

    public Path path() {
        return path;
    }

    public long pid() {
        return pid;
    }

    /**
     * Writes this process's pid.
     *
     * @throws InstanceConflictException if a live daemon holds the file
     * @throws DaemonStartupException    if the file cannot be written
     */
    public synchronized void acquire() {
        if (held) {
            return;
        }
        if (!HELD_IN_THIS_JVM.add(path)) {
            throw new InstanceConflictException("Pid file " + path + " is held by another daemon in this process");
        }
        try {
            OptionalLong existing = readPid(path);
            if (existing.isPresent() && existing.getAsLong() != pid && isAlive(existing.getAsLong())) {
                throw new InstanceConflictException(
                        "Daemon already running with pid " + existing.getAsLong() + " (pid file " + path + ")");
            }
            if (Files.exists(path)) {
                LOG.warn("Replacing stale pid file {}", path);
            }
            write();
            held = true;
            LOG.info("Wrote pid {} to {}", pid, path);
        } catch (RuntimeException e) {
            HELD_IN_THIS_JVM.remove(path);
            throw e;
        }
    }

    private void write() {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(temp, pid + "\n", StandardCharsets.US_ASCII);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DaemonStartupException("Cannot write pid file " + path + ": " + e.getMessage(), e);
        }
    }

    /** Removes the file if it still names this process. Idempotent. */
    public synchronized void release() {
        if (!held) {
            return;
        }
        held = false;
        try {
            OptionalLong current = readPid(path);
            if (current.isPresent() && current.getAsLong() == pid) {
                Files.deleteIfExists(path);
                LOG.info("Removed pid file {}", path);
            } else {
                LOG.warn("Pid file {} no longer names this process; leaving it", path);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove pid file {}: {}", path, e.getMessage());
        } finally {
            HELD_IN_THIS_JVM.remove(path);
        }
    }

    public synchronized boolean isHeld() {
        return held;
    }

    /** The pid recorded in {@code file}, or empty if it is missing or unparseable. */
    public static OptionalLong readPid(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.US_ASCII).trim();
            return content.isEmpty() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(content));
        } catch (IOException | NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
