package io.voxeldaemon.daemon;

import io.voxeldaemon.daemon.config.CommandLineOptions;
import io.voxeldaemon.daemon.config.ConfigLoader;
import io.voxeldaemon.daemon.config.DaemonConfig;
import io.voxeldaemon.daemon.lifecycle.Daemonizer;
import io.voxeldaemon.daemon.lifecycle.LifecycleState;
import io.voxeldaemon.daemon.lifecycle.OsSignals;
import io.voxeldaemon.daemon.runtime.DaemonApp;
import io.voxeldaemon.daemon.runtime.LogbackConfigurator;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: {@code voxel-daemon [--config <path>] [--daemonize] [--foreground]}.
 *
 * <p>
 * Detaches first if asked to, then delegates to {@link DaemonApp#start(String[])}
 * and maps TERM/INT/HUP onto it. Exits with the daemon's status once STOPPED,
 * or 1 if startup fails.
 */
public final class DaemonMain {

    private static final Logger LOG = LoggerFactory.getLogger(DaemonMain.class);

    private static final Duration DETACH_WAIT = Duration.ofSeconds(10);

    private DaemonMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        DaemonApp app;
        try {
            CommandLineOptions options = CommandLineOptions.parse(args);
            DaemonConfig config = ConfigLoader.load(options);
            if (options.shouldDetach(config)) {
                LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
                System.exit(Daemonizer.detach(DaemonMain.class, args, config.pidFilePath(), DETACH_WAIT));
                return;
            }
            app = DaemonApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        OsSignals signals = OsSignals.install(app::requestStop, app::requestReload);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (app.state() != LifecycleState.STOPPED) {
                LOG.info("JVM shutting down; stopping daemon");
                app.stop();
            }
        }, "voxeld-shutdown-hook"));

        int status = app.awaitTermination();
        signals.close();
        System.exit(status);
    }
}
