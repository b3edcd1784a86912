package io.hfmcp.gateway.transport;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Thrown by handlers that return a stream when the request must instead be answered with an
 * HTTP status and a JSON-RPC error body.
 */
public class TransportHttpException extends RuntimeException {

    private final HttpStatus status;
    private final transient Map<String, Object> body;

    public TransportHttpException(HttpStatus status, Map<String, Object> body) {
        super(status + " " + body);
        this.status = status;
        this.body = body;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public Map<String, Object> getBody() {
        return body;
    }
}
