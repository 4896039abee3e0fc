package io.voxeldaemon.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.voxeldaemon.core.error.InvalidParamsException;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * A {@link MethodSpec} with its parameter schema compiled. Instances live in a
 * {@link MethodRegistry} and are shared by all workers; they hold no mutable
 * state.
 */
public final class RegisteredMethod {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final MethodSpec spec;
    private final JsonSchema schema;

    RegisteredMethod(MethodSpec spec) {
        this.spec = spec;
        this.schema = spec.acceptsAnyParams() ? null : SCHEMA_FACTORY.getSchema(spec.paramSchema());
    }

    public String name() {
        return spec.name();
    }

    public MutationClass mutationClass() {
        return spec.mutationClass();
    }

    public String description() {
        return spec.description();
    }

    public List<String> paramNames() {
        return spec.paramNames();
    }

    public MethodHandler handler() {
        return spec.handler();
    }

    /**
     * Binds raw params to the declared names and validates them.
     *
     * @param raw object, array or {@code null} (absent)
     * @return the bound params
     * @throws InvalidParamsException if too many positional values are given
     *                                or the bound object violates the schema
     */
    public Params bind(JsonNode raw) {
        if (schema == null) {
            return Params.of(raw);
        }
        ObjectNode bound;
        if (raw == null || raw.isNull()) {
            bound = JsonNodeFactory.instance.objectNode();
        } else if (raw.isArray()) {
            bound = bindPositional((ArrayNode) raw);
        } else if (raw.isObject()) {
            bound = (ObjectNode) raw;
        } else {
            throw new InvalidParamsException("Params must be an object or an array");
        }

        Set<ValidationMessage> errors = schema.validate(bound);
        if (!errors.isEmpty()) {
            List<String> violations = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .toList();
            throw new InvalidParamsException("Invalid params for " + spec.name(), violations);
        }
        return Params.of(bound);
    }

    private ObjectNode bindPositional(ArrayNode values) {
        List<String> names = spec.paramNames();
        if (values.size() > names.size()) {
            throw new InvalidParamsException(spec.name() + " takes at most " + names.size()
                    + " positional parameter(s), got " + values.size());
        }
        ObjectNode bound = JsonNodeFactory.instance.objectNode();
        Iterator<JsonNode> it = values.elements();
        for (int i = 0; it.hasNext(); i++) {
            bound.set(names.get(i), it.next());
        }
        return bound;
    }

    @Override
    public String toString() {
        return "RegisteredMethod[" + spec.name() + ", " + spec.mutationClass() + "]";
    }
}
