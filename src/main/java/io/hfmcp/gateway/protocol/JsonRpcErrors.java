package io.hfmcp.gateway.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC error codes and envelope factories.
 */
public final class JsonRpcErrors {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int METHOD_NOT_ALLOWED = -32000;
    public static final int SESSION_NOT_FOUND = -32001;
    public static final int SERVER_SHUTTING_DOWN = -32002;

    private JsonRpcErrors() {
    }

    /**
     * Build an error envelope {@code {jsonrpc, error: {code, message}, id}}.
     *
     * @param id the request id, or {@code null} when unknown
     * @param code the JSON-RPC error code
     * @param message human readable message
     * @return the envelope
     */
    public static Map<String, Object> error(Object id, int code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("jsonrpc", JsonRpcMessage.VERSION);
        envelope.put("error", error);
        envelope.put("id", id);
        return envelope;
    }

    public static Map<String, Object> parseError(String detail) {
        return error(null, PARSE_ERROR, "Parse error: " + detail);
    }

    public static Map<String, Object> invalidRequest(Object id, String message) {
        return error(id, INVALID_REQUEST, message);
    }

    public static Map<String, Object> methodNotFound(Object id, String method) {
        return error(id, METHOD_NOT_FOUND, "Method not found: " + method);
    }

    public static Map<String, Object> internalError(Object id) {
        return error(id, INTERNAL_ERROR, "Internal error");
    }

    public static Map<String, Object> sessionNotFound(Object id, String sessionId) {
        return error(id, SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }

    public static Map<String, Object> methodNotAllowed(String message) {
        return error(null, METHOD_NOT_ALLOWED, message);
    }

    public static Map<String, Object> serverShuttingDown(Object id) {
        return error(id, SERVER_SHUTTING_DOWN, "Server shutting down");
    }
}
