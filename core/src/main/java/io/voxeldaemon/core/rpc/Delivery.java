package io.voxeldaemon.core.rpc;

/** Outcome of filling a {@link ResponseSlot}. */
public enum Delivery {
    /** Queued for writing to the originating connection. */
    DELIVERED,
    /** Stored in a batch that is still waiting for other elements. */
    PENDING,
    /** The originating connection is gone; the response was dropped. */
    DISCARDED,
    /** The slot was already filled; this response was ignored. */
    DUPLICATE,
    /** The request was a notification; nothing is ever written. */
    SILENT
}
