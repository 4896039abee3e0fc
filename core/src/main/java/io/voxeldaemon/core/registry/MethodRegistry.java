package io.voxeldaemon.core.registry;

import io.voxeldaemon.core.error.MethodNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable method table, built once at startup. Lookups are lock-free and
 * safe from any thread.
 *
 * <pre>{@code
 * MethodRegistry registry = MethodRegistry.builder()
 *         .register(MethodSpec.query("ping").description("Liveness check")
 *                 .handler(call -> TextNode.valueOf("pong")))
 *         .build();
 * }</pre>
 */
public final class MethodRegistry {

    private final Map<String, RegisteredMethod> methods;

    private MethodRegistry(Map<String, RegisteredMethod> methods) {
        this.methods = Collections.unmodifiableMap(methods);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Looks up a method by exact name. */
    public Optional<RegisteredMethod> find(String name) {
        return Optional.ofNullable(methods.get(name));
    }

    /**
     * Looks up a method by exact name.
     *
     * @throws MethodNotFoundException if no method has that name
     */
    public RegisteredMethod resolve(String name) {
        RegisteredMethod method = methods.get(name);
        if (method == null) {
            throw new MethodNotFoundException(name);
        }
        return method;
    }

    /** All methods in registration order. */
    public List<RegisteredMethod> methods() {
        return List.copyOf(methods.values());
    }

    public int size() {
        return methods.size();
    }

    /** Collects {@link MethodSpec}s; duplicate names fail fast. */
    public static final class Builder {
        private final List<MethodSpec> specs = new ArrayList<>();

        private Builder() {}

        public Builder register(MethodSpec spec) {
            for (MethodSpec existing : specs) {
                if (existing.name().equals(spec.name())) {
                    throw new IllegalStateException("Duplicate method registration: " + spec.name());
                }
            }
            specs.add(spec);
            return this;
        }

        public MethodRegistry build() {
            Map<String, RegisteredMethod> table = new LinkedHashMap<>();
            for (MethodSpec spec : specs) {
                table.put(spec.name(), new RegisteredMethod(spec));
            }
            return new MethodRegistry(table);
        }
    }
}
