package io.voxeldaemon.core.registry;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one registry entry: name, mutation class, description,
 * parameter shape and handler.
 *
 * <p>
 * Parameters are declared in order. Positional ({@code params: [...]}) calls
 * are bound to names using that order; named calls must use the declared
 * names. A spec built with {@link Builder#anyParams()} skips binding and
 * validation and hands the raw params to the handler.
 *
 * @param name          method name as sent on the wire
 * @param mutationClass engine access class
 * @param description   one-line description for {@code list_methods}
 * @param paramNames    declared parameter names in positional order
 * @param paramSchema   JSON Schema (draft 2020-12) of the bound params object,
 *                      or {@code null} for {@link Builder#anyParams()}
 * @param handler       implementation
 */
public record MethodSpec(
        String name,
        MutationClass mutationClass,
        String description,
        List<String> paramNames,
        ObjectNode paramSchema,
        MethodHandler handler) {

    public MethodSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mutationClass, "mutationClass");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) {
            throw new IllegalArgumentException("method name must not be blank");
        }
        paramNames = List.copyOf(paramNames);
    }

    /** Starts a query-class method declaration. */
    public static Builder query(String name) {
        return new Builder(name, MutationClass.QUERY);
    }

    /** Starts a mutation-class method declaration. */
    public static Builder mutation(String name) {
        return new Builder(name, MutationClass.MUTATION);
    }

    /** {@code true} when params are passed through without binding or validation. */
    public boolean acceptsAnyParams() {
        return paramSchema == null;
    }

    /** Builder for {@link MethodSpec}. */
    public static final class Builder {
        private final String name;
        private final MutationClass mutationClass;
        private String description = "";
        private final List<String> paramNames = new ArrayList<>();
        private final ObjectNode properties = JsonNodeFactory.instance.objectNode();
        private final List<String> required = new ArrayList<>();
        private boolean anyParams;

        private Builder(String name, MutationClass mutationClass) {
            this.name = name;
            this.mutationClass = mutationClass;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Declares a parameter that must be present. */
        public Builder required(String param, ObjectNode schema) {
            declare(param, schema);
            required.add(param);
            return this;
        }

        /** Declares a parameter that may be omitted. */
        public Builder optional(String param, ObjectNode schema) {
            declare(param, schema);
            return this;
        }

        /** Accept any params value, unvalidated (e.g. {@code echo}). */
        public Builder anyParams() {
            this.anyParams = true;
            return this;
        }

        public MethodSpec handler(MethodHandler handler) {
            return new MethodSpec(name, mutationClass, description, paramNames, buildSchema(), handler);
        }

        private void declare(String param, ObjectNode schema) {
            if (anyParams) {
                throw new IllegalStateException(name + ": anyParams() excludes declared parameters");
            }
            if (paramNames.contains(param)) {
                throw new IllegalArgumentException(name + ": duplicate parameter '" + param + "'");
            }
            paramNames.add(param);
            properties.set(param, schema);
        }

        private ObjectNode buildSchema() {
            if (anyParams) {
                return null;
            }
            ObjectNode schema = JsonNodeFactory.instance.objectNode();
            schema.put("type", "object");
            schema.set("properties", properties.deepCopy());
            ArrayNode requiredNode = schema.putArray("required");
            required.forEach(requiredNode::add);
            schema.put("additionalProperties", false);
            return schema;
        }
    }
}
