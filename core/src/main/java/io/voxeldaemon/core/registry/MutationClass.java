package io.voxeldaemon.core.registry;

/**
 * How a method touches the shared engine. Decides which side of the engine
 * gate a job acquires.
 */
public enum MutationClass {
    /** Reads engine state only; may run alongside other queries. */
    QUERY,
    /** Changes engine state; runs alone. */
    MUTATION;

    /** Lower-case name used in {@code list_methods} output. */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
