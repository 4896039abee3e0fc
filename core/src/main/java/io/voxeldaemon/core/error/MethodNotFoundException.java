package io.voxeldaemon.core.error;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/** The requested method is not in the method registry. */
public final class MethodNotFoundException extends RpcException {

    private static final long serialVersionUID = 1L;

    private final String method;

    public MethodNotFoundException(String method) {
        super(
                ErrorCode.METHOD_NOT_FOUND,
                "Method not found: " + method,
                JsonNodeFactory.instance.objectNode().put("method", method));
        this.method = method;
    }

    /** The unknown method name. */
    public String method() {
        return method;
    }
}
