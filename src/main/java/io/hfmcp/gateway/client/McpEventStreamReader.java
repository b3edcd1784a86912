package io.hfmcp.gateway.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reads JSON-RPC messages from a {@code text/event-stream} response body until the response to
 * a given request id arrives.
 */
final class McpEventStreamReader {

    private static final Logger log = LoggerFactory.getLogger(McpEventStreamReader.class);

    private final ObjectMapper objectMapper;

    McpEventStreamReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param body the event stream
     * @param requestId id of the request whose response ends the read
     * @param notifications receives server notifications seen before the response
     * @return the response, or null if the stream ended without one
     */
    JsonRpcMessage read(InputStream body, Object requestId, Consumer<JsonRpcMessage> notifications) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        StringBuilder data = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                JsonRpcMessage response = dispatch(data, requestId, notifications);
                if (response != null) {
                    return response;
                }
            } else if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
            }
        }
        return dispatch(data, requestId, notifications);
    }

    private JsonRpcMessage dispatch(StringBuilder data, Object requestId, Consumer<JsonRpcMessage> notifications) {
        if (data.length() == 0) {
            return null;
        }
        String payload = data.toString();
        data.setLength(0);
        JsonRpcMessage message;
        try {
            message = JsonRpcMessage.parse(objectMapper, payload);
        } catch (RuntimeException e) {
            log.debug("Skipping unparseable event: {}", e.getMessage());
            return null;
        }
        if (message.isResponse() && sameId(message.id(), requestId)) {
            return message;
        }
        if (message.isNotification()) {
            notifications.accept(message);
        }
        return null;
    }

    static boolean sameId(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.longValue() == y.longValue();
        }
        return Objects.equals(String.valueOf(a), String.valueOf(b));
    }
}
