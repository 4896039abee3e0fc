package io.voxeldaemon.core.methods;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.voxeldaemon.core.registry.CallContext;
import io.voxeldaemon.core.registry.MethodRegistry;
import io.voxeldaemon.core.registry.MethodSpec;
import io.voxeldaemon.core.registry.RegisteredMethod;

/** Methods about the daemon itself: {@code ping}, {@code echo}, {@code version}, {@code status}, {@code list_methods}. */
public final class SystemMethods {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final StatusProvider statusProvider;

    public SystemMethods(StatusProvider statusProvider) {
        this.statusProvider = statusProvider;
    }

    public void registerAll(MethodRegistry.Builder builder) {
        builder.register(MethodSpec.query("ping")
                .description("Liveness check; returns \"pong\"")
                .handler(call -> TextNode.valueOf("pong")));
        builder.register(MethodSpec.query("echo")
                .description("Returns its params unchanged")
                .anyParams()
                .handler(SystemMethods::echo));
        builder.register(MethodSpec.query("version")
                .description("Daemon and protocol version")
                .handler(call -> version()));
        builder.register(MethodSpec.query("status")
                .description("Daemon state, load and counters")
                .handler(this::status));
        builder.register(MethodSpec.query("list_methods")
                .description("Lists every registered method")
                .handler(SystemMethods::listMethods));
    }

    private static JsonNode echo(CallContext call) {
        JsonNode raw = call.params().raw();
        return raw == null || raw.isNull() ? NODES.objectNode() : raw;
    }

    private static JsonNode version() {
        ObjectNode node = NODES.objectNode();
        node.put("version", DaemonVersion.VERSION);
        node.put("type", "daemon");
        node.put("protocol", DaemonVersion.PROTOCOL);
        return node;
    }

    private JsonNode status(CallContext call) {
        ObjectNode node = statusProvider.snapshot();
        node.put("methods_available", call.registry().size());
        return node;
    }

    private static JsonNode listMethods(CallContext call) {
        ObjectNode node = NODES.objectNode();
        node.put("count", call.registry().size());
        ArrayNode methods = node.putArray("methods");
        for (RegisteredMethod method : call.registry().methods()) {
            ObjectNode entry = methods.addObject();
            entry.put("method", method.name());
            entry.put("description", method.description());
            entry.put("mutation", method.mutationClass().label());
        }
        return node;
    }
}
