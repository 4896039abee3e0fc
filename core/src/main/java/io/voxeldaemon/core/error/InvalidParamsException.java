package io.voxeldaemon.core.error;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Parameters are missing, malformed or out of range. Thrown by the dispatcher
 * when schema validation fails and by handlers for semantic checks the schema
 * cannot express.
 */
public final class InvalidParamsException extends RpcException {

    private static final long serialVersionUID = 1L;

    public InvalidParamsException(String message) {
        super(ErrorCode.INVALID_PARAMS, message);
    }

    public InvalidParamsException(String message, List<String> violations) {
        super(ErrorCode.INVALID_PARAMS, message, violationsNode(violations));
    }

    private static ObjectNode violationsNode(List<String> violations) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        ArrayNode list = data.putArray("violations");
        violations.forEach(list::add);
        return data;
    }
}
