package io.voxeldaemon.daemon.lifecycle;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detaches the daemon into the background.
 *
 * <p>
 * The JVM cannot fork, so the current command line is re-executed with
 * {@code --foreground} in a new session (via {@code setsid} where present),
 * stdin and stdout detached. The parent waits until the child has written its
 * pid file and then exits.
 */
public final class Daemonizer {

    private static final Logger LOG = LoggerFactory.getLogger(Daemonizer.class);

    private static final Path SETSID = Path.of("/usr/bin/setsid");
    private static final long POLL_MS = 50;

    private Daemonizer() {}

    /**
     * Builds the child command line: same JVM, options, class path and main
     * class, with {@code --daemonize} dropped and {@code --foreground} added.
     */
    static List<String> childCommand(String javaBinary, List<String> jvmOptions, String classPath, String mainClass,
            String[] args, boolean useSetsid) {
        List<String> command = new ArrayList<>();
        if (useSetsid) {
            command.add(SETSID.toString());
        }
        command.add(javaBinary);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classPath);
        command.add(mainClass);
        for (String arg : args) {
            if (!"--daemonize".equals(arg) && !"--foreground".equals(arg)) {
                command.add(arg);
            }
        }
        command.add("--foreground");
        return command;
    }

    /**
     * Starts the background copy and waits for it to come up.
     *
     * @param mainClass entry point to re-run
     * @param args      original command line arguments
     * @param pidFile   pid file the child writes once its listener is bound
     * @param wait      how long to wait for the child
     * @return exit status for the parent: 0 if the child is running
     */
    public static int detach(Class<?> mainClass, String[] args, Path pidFile, Duration wait) {
        String javaBinary = ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        List<String> command = childCommand(javaBinary,
                ManagementFactory.getRuntimeMXBean().getInputArguments(),
                System.getProperty("java.class.path"), mainClass.getName(), args, Files.isExecutable(SETSID));
        Process child;
        try {
            child = new ProcessBuilder(command)
                    .redirectInput(new File("/dev/null"))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            LOG.error("Could not start background daemon: {}", e.getMessage());
            return 1;
        }
        long deadline = System.nanoTime() + wait.toNanos();
        while (System.nanoTime() < deadline) {
            OptionalLong written = PidFile.readPid(pidFile);
            if (written.isPresent() && written.getAsLong() == child.pid()) {
                LOG.info("Daemon detached (pid {})", child.pid());
                return 0;
            }
            try {
                if (child.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                    LOG.error("Background daemon exited during startup with code {}", child.exitValue());
                    return child.exitValue() == 0 ? 1 : child.exitValue();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 1;
            }
        }
        LOG.error("Background daemon (pid {}) did not write {} within {} ms", child.pid(), pidFile, wait.toMillis());
        return 1;
    }
}
