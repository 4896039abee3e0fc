package io.voxeldaemon.daemon.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link DaemonConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * YAML keys are mapped onto {@link DaemonConfig.Builder}; missing keys keep
 * the builder defaults. Every key can be overridden by a {@code VOXELD_*}
 * environment variable, which takes precedence over the YAML value. An env
 * var counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Loads the file named on the command line, overlaying {@link System#getenv}. */
    public static DaemonConfig load(CommandLineOptions options) {
        if (!options.explicitConfig() && !Files.exists(options.configPath())) {
            return fromTree(MissingNode.getInstance(), System::getenv);
        }
        return load(options.configPath(), System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static DaemonConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from
     * {@code envLookup} (returning {@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static DaemonConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = MissingNode.getInstance(); // empty file
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return fromTree(root, envLookup);
    }

    /** Maps a parsed YAML tree onto the builder, then overlays the environment. */
    static DaemonConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        DaemonConfig.Builder builder = DaemonConfig.builder();

        JsonNode socket = root.path("socket");
        text(socket, "path", builder::socketPath);
        text(socket, "permissions", builder::socketPermissions);

        JsonNode process = root.path("process");
        text(process, "pid-file", builder::pidFile);
        bool(process, "daemonize", builder::daemonize);
        text(process, "ready-command", builder::readyCommand);

        JsonNode worker = root.path("worker");
        integer(worker, "worker.count", "count", builder::workerCount);
        integer(worker, "worker.queue-size", "queue-size", builder::queueSize);
        longValue(worker, "worker.request-timeout-ms", "request-timeout-ms", builder::requestTimeoutMs);

        JsonNode limits = root.path("limits");
        integer(limits, "limits.max-connections", "max-connections", builder::maxConnections);
        integer(limits, "limits.max-message-bytes", "max-message-bytes", builder::maxMessageBytes);
        longValue(limits, "limits.idle-timeout-ms", "idle-timeout-ms", builder::idleTimeoutMs);
        longValue(limits, "limits.max-pending-output-bytes", "max-pending-output-bytes",
                builder::maxPendingOutputBytes);

        JsonNode protocol = root.path("protocol");
        if (protocol.has("response-ordering")) {
            builder.responseOrdering(ResponseOrdering.fromConfig(protocol.get("response-ordering").asText()));
        }

        JsonNode lifecycle = root.path("lifecycle");
        longValue(lifecycle, "lifecycle.shutdown-grace-ms", "shutdown-grace-ms", builder::shutdownGraceMs);

        JsonNode reload = root.path("reload");
        bool(reload, "watch-config", builder::reloadWatchConfig);
        integer(reload, "reload.debounce-ms", "debounce-ms", builder::reloadDebounceMs);

        JsonNode logging = root.path("logging");
        text(logging, "format", builder::loggingFormat);
        text(logging, "level", builder::loggingLevel);

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(DaemonConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "VOXELD_SOCKET_PATH", builder::socketPath);
        envString(envLookup, "VOXELD_SOCKET_PERMISSIONS", builder::socketPermissions);
        envString(envLookup, "VOXELD_PID_FILE", builder::pidFile);
        envBool(envLookup, "VOXELD_DAEMONIZE", builder::daemonize);
        envString(envLookup, "VOXELD_READY_COMMAND", builder::readyCommand);

        envInt(envLookup, "VOXELD_WORKER_COUNT", builder::workerCount);
        envInt(envLookup, "VOXELD_QUEUE_SIZE", builder::queueSize);
        envLong(envLookup, "VOXELD_REQUEST_TIMEOUT_MS", builder::requestTimeoutMs);

        envInt(envLookup, "VOXELD_MAX_CONNECTIONS", builder::maxConnections);
        envInt(envLookup, "VOXELD_MAX_MESSAGE_BYTES", builder::maxMessageBytes);
        envLong(envLookup, "VOXELD_IDLE_TIMEOUT_MS", builder::idleTimeoutMs);
        envLong(envLookup, "VOXELD_MAX_PENDING_OUTPUT_BYTES", builder::maxPendingOutputBytes);

        if (isSet(envLookup, "VOXELD_RESPONSE_ORDERING")) {
            builder.responseOrdering(ResponseOrdering.fromConfig(envLookup.apply("VOXELD_RESPONSE_ORDERING")));
        }
        envLong(envLookup, "VOXELD_SHUTDOWN_GRACE_MS", builder::shutdownGraceMs);

        envBool(envLookup, "VOXELD_RELOAD_WATCH_CONFIG", builder::reloadWatchConfig);
        envInt(envLookup, "VOXELD_RELOAD_DEBOUNCE_MS", builder::reloadDebounceMs);

        envString(envLookup, "VOXELD_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "VOXELD_LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static void text(JsonNode section, String field, Consumer<String> setter) {
        if (section.has(field) && !section.get(field).isNull()) {
            setter.accept(section.get(field).asText());
        }
    }

    private static void bool(JsonNode section, String field, Consumer<Boolean> setter) {
        if (section.has(field)) {
            setter.accept(section.get(field).asBoolean());
        }
    }

    private static void integer(JsonNode section, String key, String field, IntConsumer setter) {
        if (section.has(field)) {
            JsonNode value = section.get(field);
            if (!value.canConvertToInt() || !value.isIntegralNumber()) {
                throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
            }
            setter.accept(value.intValue());
        }
    }

    private static void longValue(JsonNode section, String key, String field, LongConsumer setter) {
        if (section.has(field)) {
            JsonNode value = section.get(field);
            if (!value.canConvertToLong() || !value.isIntegralNumber()) {
                throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
            }
            setter.accept(value.longValue());
        }
    }
}
