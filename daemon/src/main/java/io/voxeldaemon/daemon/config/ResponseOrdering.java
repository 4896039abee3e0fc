package io.voxeldaemon.daemon.config;

import java.util.Locale;

/** How a connection orders the responses it writes ({@code protocol.response-ordering}). */
public enum ResponseOrdering {
    /** Write responses as they complete; clients correlate by id. */
    ID,
    /** Resequence responses into request arrival order per connection. */
    STRICT;

    /** Parses the configuration value, case-insensitively. */
    public static ResponseOrdering fromConfig(String value) {
        if (value != null) {
            for (ResponseOrdering ordering : values()) {
                if (ordering.name().equalsIgnoreCase(value.trim())) {
                    return ordering;
                }
            }
        }
        throw new ConfigLoadException(
                "protocol.response-ordering must be 'id' or 'strict', got '" + value + "'");
    }

    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
