package io.voxeldaemon.core.methods;

import io.voxeldaemon.core.registry.MethodRegistry;
import java.util.function.Consumer;

/** Assembles the registry the daemon serves. */
public final class BuiltinMethods {

    private BuiltinMethods() {}

    /** Registry with the system and project methods. */
    public static MethodRegistry registry(StatusProvider statusProvider) {
        return registry(statusProvider, builder -> {});
    }

    /**
     * Registry with the system and project methods plus whatever
     * {@code customizer} registers. Duplicates of built-in names are rejected.
     */
    public static MethodRegistry registry(StatusProvider statusProvider, Consumer<MethodRegistry.Builder> customizer) {
        MethodRegistry.Builder builder = MethodRegistry.builder();
        new SystemMethods(statusProvider).registerAll(builder);
        new ProjectMethods().registerAll(builder);
        customizer.accept(builder);
        return builder.build();
    }
}
