package io.voxeldaemon.daemon.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.daemon.config.ResponseOrdering;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides when a completed response of one connection may be written.
 *
 * <p>
 * Under {@link ResponseOrdering#ID} every payload is released as soon as it
 * is completed. Under {@link ResponseOrdering#STRICT} payloads are held back
 * until every lower sequence number has been completed, so the connection
 * sees responses in request arrival order. A {@code null} payload completes
 * its sequence without producing output.
 *
 * <p>
 * Thread-safe: reservations come from the I/O thread, completions from
 * workers.
 */
public final class ResponseSequencer {

    private final ResponseOrdering ordering;
    private final Map<Long, JsonNode> held = new TreeMap<>();
    private long nextReserved;
    private long nextToRelease;

    public ResponseSequencer(ResponseOrdering ordering) {
        this.ordering = ordering;
    }

    public ResponseOrdering ordering() {
        return ordering;
    }

    public synchronized long reserve() {
        return nextReserved++;
    }

    /**
     * Records the payload for {@code sequence}.
     *
     * @return payloads that may now be written, in write order; empty if the
     *         payload has to wait for earlier sequences
     */
    public synchronized List<JsonNode> complete(long sequence, JsonNode payload) {
        if (sequence < nextToRelease || sequence >= nextReserved || held.containsKey(sequence)) {
            throw new IllegalStateException("Sequence " + sequence + " was not reserved or is already completed");
        }
        if (ordering == ResponseOrdering.ID) {
            return payload == null ? Collections.emptyList() : Collections.singletonList(payload);
        }
        held.put(sequence, payload);
        List<JsonNode> ready = new ArrayList<>();
        while (held.containsKey(nextToRelease)) {
            JsonNode next = held.remove(nextToRelease);
            nextToRelease++;
            if (next != null) {
                ready.add(next);
            }
        }
        return ready;
    }

    /** Completed payloads still waiting for an earlier sequence. */
    public synchronized int heldBack() {
        return held.size();
    }
}
