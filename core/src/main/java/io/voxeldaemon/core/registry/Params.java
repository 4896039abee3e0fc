package io.voxeldaemon.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.voxeldaemon.core.error.InvalidParamsException;

/**
 * Read-only view over the params of one call. For methods with a declared
 * parameter list this is the bound, schema-validated params object, so the
 * typed getters only fail on shapes the schema cannot express.
 */
public final class Params {

    private static final Params EMPTY = new Params(JsonNodeFactory.instance.objectNode());

    private final JsonNode node;

    private Params(JsonNode node) {
        this.node = node;
    }

    /** Wraps a params value; {@code null} becomes an empty object. */
    public static Params of(JsonNode node) {
        return node == null ? EMPTY : new Params(node);
    }

    public static Params empty() {
        return EMPTY;
    }

    /** The underlying params value (object, or array for pass-through methods). */
    public JsonNode raw() {
        return node;
    }

    /** {@code true} if the named member is present and not JSON null. */
    public boolean has(String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    public int requireInt(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw new InvalidParamsException("Missing required parameter '" + name + "'");
        }
        return toInt(name, value);
    }

    public int optInt(String name, int defaultValue) {
        return has(name) ? toInt(name, node.get(name)) : defaultValue;
    }

    public String requireString(String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            throw new InvalidParamsException("Missing required parameter '" + name + "'");
        }
        if (!value.isTextual()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be a string");
        }
        return value.asText();
    }

    public String optString(String name, String defaultValue) {
        return has(name) ? requireString(name) : defaultValue;
    }

    public boolean optBoolean(String name, boolean defaultValue) {
        if (!has(name)) {
            return defaultValue;
        }
        JsonNode value = node.get(name);
        if (!value.isBoolean()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be a boolean");
        }
        return value.booleanValue();
    }

    public ArrayNode requireArray(String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isArray()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be an array");
        }
        return (ArrayNode) value;
    }

    /** Params as an object; pass-through methods may see arrays instead. */
    public ObjectNode asObject() {
        if (!node.isObject()) {
            throw new InvalidParamsException("Params must be an object");
        }
        return (ObjectNode) node;
    }

    static int toInt(String name, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new InvalidParamsException("Parameter '" + name + "' must be an integer");
        }
        return value.intValue();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
