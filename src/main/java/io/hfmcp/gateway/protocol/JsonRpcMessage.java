package io.hfmcp.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One inbound JSON-RPC message: a request, a notification or a response.
 *
 * <p>A request carries both an id and a method; a notification only a method; a response only
 * an id together with a result or an error.</p>
 */
public record JsonRpcMessage(
    Object id,
    String method,
    Map<String, Object> params,
    Map<String, Object> result,
    Map<String, Object> error
) {

    public static final String VERSION = "2.0";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public JsonRpcMessage {
        params = params == null ? Map.of() : params;
    }

    public boolean isRequest() {
        return id != null && method != null;
    }

    public boolean isNotification() {
        return id == null && method != null;
    }

    public boolean isResponse() {
        return method == null;
    }

    /**
     * Key under which per-method metrics are recorded: the method name, with the tool name
     * appended for {@code tools/call}.
     */
    public String trackingKey() {
        if ("tools/call".equals(method) && params.get("name") instanceof String name) {
            return method + ":" + name;
        }
        return method != null ? method : "response";
    }

    /**
     * Parse a raw message body.
     *
     * @param mapper the object mapper
     * @param body raw JSON text
     * @return the parsed message
     * @throws McpProtocolException with {@link JsonRpcErrors#PARSE_ERROR} for malformed JSON or
     *         {@link JsonRpcErrors#INVALID_REQUEST} for JSON that is not a JSON-RPC message
     */
    public static JsonRpcMessage parse(ObjectMapper mapper, String body) {
        if (body == null || body.isBlank()) {
            throw new McpProtocolException(JsonRpcErrors.PARSE_ERROR, "Empty request body");
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new McpProtocolException(JsonRpcErrors.PARSE_ERROR, e.getOriginalMessage(), e);
        }
        return fromNode(mapper, node);
    }

    public static JsonRpcMessage fromNode(ObjectMapper mapper, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new McpProtocolException(JsonRpcErrors.INVALID_REQUEST, "Invalid Request: expected a JSON object");
        }
        Object id = idValue(node.get("id"));
        JsonNode method = node.get("method");
        if (method != null && !method.isTextual()) {
            throw new McpProtocolException(JsonRpcErrors.INVALID_REQUEST, "Invalid Request: method must be a string");
        }
        if (method == null && id == null) {
            throw new McpProtocolException(JsonRpcErrors.INVALID_REQUEST, "Invalid Request: missing method");
        }
        return new JsonRpcMessage(
            id,
            method != null ? method.asText() : null,
            objectValue(mapper, node.get("params")),
            objectValue(mapper, node.get("result")),
            objectValue(mapper, node.get("error")));
    }

    /**
     * Serialise an outbound request or notification.
     */
    public static Map<String, Object> request(Object id, String method, Map<String, Object> params) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", VERSION);
        if (id != null) {
            message.put("id", id);
        }
        message.put("method", method);
        if (params != null) {
            message.put("params", params);
        }
        return message;
    }

    public static Map<String, Object> response(Object id, Object result) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", VERSION);
        message.put("id", id);
        message.put("result", result);
        return message;
    }

    private static Object idValue(JsonNode id) {
        if (id == null || id.isNull()) {
            return null;
        }
        if (id.isIntegralNumber()) {
            return id.longValue();
        }
        return id.asText();
    }

    private static Map<String, Object> objectValue(ObjectMapper mapper, JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return mapper.convertValue(node, MAP_TYPE);
    }
}
