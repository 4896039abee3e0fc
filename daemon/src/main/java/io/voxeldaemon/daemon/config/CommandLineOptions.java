package io.voxeldaemon.daemon.config;

import java.nio.file.Path;

/**
 * Parsed command line: {@code [--config <path>] [--daemonize] [--foreground]}.
 *
 * @param configPath     configuration file
 * @param explicitConfig whether {@code --config} was given; an explicit file must exist
 * @param daemonize      {@code --daemonize} was given
 * @param foreground     {@code --foreground} was given; overrides any daemonize setting
 */
public record CommandLineOptions(Path configPath, boolean explicitConfig, boolean daemonize, boolean foreground) {

    public static final String DEFAULT_CONFIG_FILE = "voxel-daemon.yaml";

    /**
     * @throws IllegalArgumentException on unknown flags or a missing {@code --config} value
     */
    public static CommandLineOptions parse(String[] args) {
        Path config = Path.of(DEFAULT_CONFIG_FILE);
        boolean explicit = false;
        boolean daemonize = false;
        boolean foreground = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file path argument");
                    }
                    config = Path.of(args[++i]);
                    explicit = true;
                }
                case "--daemonize" -> daemonize = true;
                case "--foreground" -> foreground = true;
                default -> throw new IllegalArgumentException(
                        "Unknown argument: " + args[i] + " (usage: [--config <path>] [--daemonize] [--foreground])");
            }
        }
        return new CommandLineOptions(config, explicit, daemonize, foreground);
    }

    /** Whether to detach, given the configured {@code process.daemonize}. */
    public boolean shouldDetach(DaemonConfig config) {
        return !foreground && (daemonize || config.daemonize());
    }
}
