package io.voxeldaemon.core.registry;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Small factory for the JSON Schema fragments used to declare parameter
 * shapes. Each call returns a fresh node.
 */
public final class Schemas {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Schemas() {
        // utility class
    }

    public static ObjectNode integer() {
        return NODES.objectNode().put("type", "integer");
    }

    public static ObjectNode integer(int minimum, int maximum) {
        return integer().put("minimum", minimum).put("maximum", maximum);
    }

    /** Integer in {@code 0..255}, used for color components. */
    public static ObjectNode colorComponent() {
        return integer(0, 255);
    }

    public static ObjectNode positiveInteger() {
        return integer().put("minimum", 1);
    }

    public static ObjectNode string() {
        return NODES.objectNode().put("type", "string");
    }

    public static ObjectNode nonEmptyString() {
        return string().put("minLength", 1);
    }

    public static ObjectNode bool() {
        return NODES.objectNode().put("type", "boolean");
    }

    public static ObjectNode arrayOf(ObjectNode items) {
        ObjectNode node = NODES.objectNode().put("type", "array");
        node.set("items", items);
        return node;
    }

    /** A loose object schema; nested properties are checked by the handler. */
    public static ObjectNode object() {
        return NODES.objectNode().put("type", "object");
    }
}
