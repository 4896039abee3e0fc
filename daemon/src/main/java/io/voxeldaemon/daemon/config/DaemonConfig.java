package io.voxeldaemon.daemon.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Root configuration of the daemon.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances;
 * {@link Builder#build()} validates ranges and reports every problem at once.
 *
 * @param socketPath        Unix socket path
 * @param socketPermissions octal permission mode applied to the socket file
 * @param pidFile           instance-identity file
 * @param daemonize         detach into the background at startup
 * @param readyCommand      optional auxiliary command started once running, blank for none
 * @param workerCount       fixed number of worker threads
 * @param queueSize         bound of the work queue
 * @param requestTimeoutMs  per-job execution budget, 0 disables it
 * @param maxConnections    connections served at once
 * @param maxMessageBytes   largest accepted frame
 * @param idleTimeoutMs     idle connection timeout, 0 disables it
 * @param maxPendingOutputBytes unsent output per connection above which reading pauses
 * @param responseOrdering  per-connection response ordering policy
 * @param shutdownGraceMs   time in-flight jobs get to finish on shutdown
 * @param reloadWatchConfig reload when the config file changes
 * @param reloadDebounceMs  debounce for config file change events
 * @param loggingFormat     {@code text} or {@code json}
 * @param loggingLevel      root log level
 */
public record DaemonConfig(
        String socketPath,
        String socketPermissions,
        String pidFile,
        boolean daemonize,
        String readyCommand,
        int workerCount,
        int queueSize,
        long requestTimeoutMs,
        int maxConnections,
        int maxMessageBytes,
        long idleTimeoutMs,
        long maxPendingOutputBytes,
        ResponseOrdering responseOrdering,
        long shutdownGraceMs,
        boolean reloadWatchConfig,
        int reloadDebounceMs,
        String loggingFormat,
        String loggingLevel) {

    private static final Pattern OCTAL_MODE = Pattern.compile("0?[0-7]{3}");
    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");
    private static final Set<String> FORMATS = Set.of("text", "json");

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Defaults only. */
    public static DaemonConfig defaults() {
        return builder().build();
    }

    public Path socketFile() {
        return Path.of(socketPath);
    }

    public Path pidFilePath() {
        return Path.of(pidFile);
    }

    public boolean hasReadyCommand() {
        return readyCommand != null && !readyCommand.isBlank();
    }

    /** A builder preloaded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .socketPath(socketPath)
                .socketPermissions(socketPermissions)
                .pidFile(pidFile)
                .daemonize(daemonize)
                .readyCommand(readyCommand)
                .workerCount(workerCount)
                .queueSize(queueSize)
                .requestTimeoutMs(requestTimeoutMs)
                .maxConnections(maxConnections)
                .maxMessageBytes(maxMessageBytes)
                .idleTimeoutMs(idleTimeoutMs)
                .maxPendingOutputBytes(maxPendingOutputBytes)
                .responseOrdering(responseOrdering)
                .shutdownGraceMs(shutdownGraceMs)
                .reloadWatchConfig(reloadWatchConfig)
                .reloadDebounceMs(reloadDebounceMs)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    /** Builder for {@link DaemonConfig}. */
    public static final class Builder {
        private String socketPath = "/tmp/goxel.sock";
        private String socketPermissions = "0666";
        private String pidFile = "/tmp/goxel-daemon.pid";
        private boolean daemonize = false;
        private String readyCommand = "";
        private int workerCount = 4;
        private int queueSize = 1000;
        private long requestTimeoutMs = 30_000;
        private int maxConnections = 10;
        private int maxMessageBytes = 10_485_760; // 10 MB
        private long idleTimeoutMs = 0;
        private long maxPendingOutputBytes = 16_777_216; // 16 MB
        private ResponseOrdering responseOrdering = ResponseOrdering.ID;
        private long shutdownGraceMs = 10_000;
        private boolean reloadWatchConfig = false;
        private int reloadDebounceMs = 500;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder socketPath(String socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder socketPermissions(String socketPermissions) {
            this.socketPermissions = socketPermissions;
            return this;
        }

        public Builder pidFile(String pidFile) {
            this.pidFile = pidFile;
            return this;
        }

        public Builder daemonize(boolean daemonize) {
            this.daemonize = daemonize;
            return this;
        }

        public Builder readyCommand(String readyCommand) {
            this.readyCommand = readyCommand;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        public Builder requestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxMessageBytes(int maxMessageBytes) {
            this.maxMessageBytes = maxMessageBytes;
            return this;
        }

        public Builder idleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
            return this;
        }

        public Builder maxPendingOutputBytes(long maxPendingOutputBytes) {
            this.maxPendingOutputBytes = maxPendingOutputBytes;
            return this;
        }

        public Builder responseOrdering(ResponseOrdering responseOrdering) {
            this.responseOrdering = responseOrdering;
            return this;
        }

        public Builder shutdownGraceMs(long shutdownGraceMs) {
            this.shutdownGraceMs = shutdownGraceMs;
            return this;
        }

        public Builder reloadWatchConfig(boolean reloadWatchConfig) {
            this.reloadWatchConfig = reloadWatchConfig;
            return this;
        }

        public Builder reloadDebounceMs(int reloadDebounceMs) {
            this.reloadDebounceMs = reloadDebounceMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @throws ConfigLoadException listing every invalid key
         */
        public DaemonConfig build() {
            List<String> problems = new ArrayList<>();
            if (socketPath == null || socketPath.isBlank()) {
                problems.add("socket.path is required");
            }
            if (socketPermissions == null || !OCTAL_MODE.matcher(socketPermissions.trim()).matches()) {
                problems.add("socket.permissions must be an octal mode such as \"0660\", got '" + socketPermissions
                        + "'");
            }
            if (pidFile == null || pidFile.isBlank()) {
                problems.add("process.pid-file is required");
            }
            if (workerCount < 1 || workerCount > 1024) {
                problems.add("worker.count must be between 1 and 1024, got " + workerCount);
            }
            if (queueSize < 1) {
                problems.add("worker.queue-size must be >= 1, got " + queueSize);
            }
            if (requestTimeoutMs < 0) {
                problems.add("worker.request-timeout-ms must be >= 0, got " + requestTimeoutMs);
            }
            if (maxConnections < 1) {
                problems.add("limits.max-connections must be >= 1, got " + maxConnections);
            }
            if (maxMessageBytes < 64) {
                problems.add("limits.max-message-bytes must be >= 64, got " + maxMessageBytes);
            }
            if (idleTimeoutMs < 0) {
                problems.add("limits.idle-timeout-ms must be >= 0, got " + idleTimeoutMs);
            }
            if (maxPendingOutputBytes < 1024) {
                problems.add("limits.max-pending-output-bytes must be >= 1024, got " + maxPendingOutputBytes);
            }
            if (responseOrdering == null) {
                problems.add("protocol.response-ordering is required");
            }
            if (shutdownGraceMs < 0) {
                problems.add("lifecycle.shutdown-grace-ms must be >= 0, got " + shutdownGraceMs);
            }
            if (reloadDebounceMs < 0) {
                problems.add("reload.debounce-ms must be >= 0, got " + reloadDebounceMs);
            }
            String format = loggingFormat == null ? "" : loggingFormat.trim().toLowerCase(Locale.ROOT);
            if (!FORMATS.contains(format)) {
                problems.add("logging.format must be 'text' or 'json', got '" + loggingFormat + "'");
            }
            String level = loggingLevel == null ? "" : loggingLevel.trim().toUpperCase(Locale.ROOT);
            if (!LEVELS.contains(level)) {
                problems.add("logging.level must be one of " + LEVELS + ", got '" + loggingLevel + "'");
            }
            if (!problems.isEmpty()) {
                throw new ConfigLoadException("Invalid configuration: " + String.join("; ", problems));
            }

            return new DaemonConfig(
                    socketPath.trim(),
                    socketPermissions.trim(),
                    pidFile.trim(),
                    daemonize,
                    readyCommand == null ? "" : readyCommand.trim(),
                    workerCount,
                    queueSize,
                    requestTimeoutMs,
                    maxConnections,
                    maxMessageBytes,
                    idleTimeoutMs,
                    maxPendingOutputBytes,
                    responseOrdering,
                    shutdownGraceMs,
                    reloadWatchConfig,
                    reloadDebounceMs,
                    format,
                    level);
        }
    }
}
