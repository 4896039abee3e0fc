package io.voxeldaemon.daemon.server;

import io.voxeldaemon.daemon.config.DaemonConfig;
import io.voxeldaemon.daemon.config.ResponseOrdering;

/**
 * The reloadable part of connection handling.
 *
 * @param maxConnections  connections served at once
 * @param maxMessageBytes frame cap
 * @param idleTimeoutMs   idle close threshold, 0 disables it
 * @param maxPendingOutputBytes unsent output above which a connection stops being read
 * @param ordering        ordering policy for connections accepted from now on
 */
public record ConnectionLimits(
        int maxConnections,
        int maxMessageBytes,
        long idleTimeoutMs,
        long maxPendingOutputBytes,
        ResponseOrdering ordering) {

    public static ConnectionLimits from(DaemonConfig config) {
        return new ConnectionLimits(config.maxConnections(), config.maxMessageBytes(), config.idleTimeoutMs(),
                config.maxPendingOutputBytes(), config.responseOrdering());
    }
}
