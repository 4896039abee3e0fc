package io.voxeldaemon.core.methods;

/** Version strings reported by {@code version} and {@code goxel.get_status}. */
public final class DaemonVersion {

    public static final String VERSION = "1.0.0";
    public static final String PROTOCOL = "JSON-RPC 2.0";

    private DaemonVersion() {}
}
