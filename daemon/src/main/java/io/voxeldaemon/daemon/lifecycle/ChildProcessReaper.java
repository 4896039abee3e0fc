package io.voxeldaemon.daemon.lifecycle;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks auxiliary child processes. Each registered process's exit invokes
 * the exit callback (the daemon posts {@link LifecycleEvent#CHILD_EXITED});
 * {@link #reap()} then forgets every exited child.
 */
public final class ChildProcessReaper {

    private static final Logger LOG = LoggerFactory.getLogger(ChildProcessReaper.class);

    /** A child that has exited. */
    public record ExitedChild(long pid, String command, int exitCode) {}

    private final Map<Long, Process> children = new ConcurrentHashMap<>();
    private final Map<Long, String> commands = new ConcurrentHashMap<>();
    private final Runnable exitCallback;

    public ChildProcessReaper(Runnable exitCallback) {
        this.exitCallback = exitCallback;
    }

    /**
     * Starts {@code commandLine}, split on whitespace, and registers it.
     *
     * @throws IOException if the process cannot be started
     */
    public Process start(String commandLine) throws IOException {
        List<String> command = Arrays.asList(commandLine.trim().split("\\s+"));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        register(process, String.join(" ", command));
        return process;
    }

    /** Registers an already started child. */
    public void register(Process process, String description) {
        long pid = process.pid();
        children.put(pid, process);
        commands.put(pid, description);
        LOG.info("Started child process {} (pid {})", description, pid);
        process.onExit().thenRun(exitCallback);
    }

    /** Forgets every exited child and returns them. */
    public List<ExitedChild> reap() {
        List<ExitedChild> exited = new ArrayList<>();
        for (Map.Entry<Long, Process> entry : children.entrySet()) {
            Process process = entry.getValue();
            if (!process.isAlive() && children.remove(entry.getKey(), process)) {
                String command = commands.remove(entry.getKey());
                exited.add(new ExitedChild(entry.getKey(), command, process.exitValue()));
            }
        }
        for (ExitedChild child : exited) {
            LOG.info("Child process {} (pid {}) exited with code {}", child.command(), child.pid(), child.exitCode());
        }
        return exited;
    }

    /** Children still registered. */
    public int size() {
        return children.size();
    }

    /** Terminates every remaining child, forcibly after {@code grace}. */
    public void destroyAll(Duration grace) {
        List<Process> remaining = new ArrayList<>(children.values());
        for (Process process : remaining) {
            process.destroy();
        }
        for (Process process : remaining) {
            try {
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Child process {} ignored termination; killing it", process.pid());
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        children.clear();
        commands.clear();
    }
}
