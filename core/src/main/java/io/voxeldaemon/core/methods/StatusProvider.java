package io.voxeldaemon.core.methods;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Supplies the daemon-level part of the {@code status} result: lifecycle
 * state, pid, connection and queue figures, counters. Implemented by the
 * daemon runtime; must be callable from any worker thread.
 */
@FunctionalInterface
public interface StatusProvider {
    ObjectNode snapshot();
}
