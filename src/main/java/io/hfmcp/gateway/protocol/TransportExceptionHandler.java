package io.hfmcp.gateway.protocol;

import io.hfmcp.gateway.transport.TransportHttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Turns transport failures raised by stream-returning handlers into JSON-RPC error responses.
 */
@RestControllerAdvice
public class TransportExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TransportExceptionHandler.class);

    @ExceptionHandler(TransportHttpException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(TransportHttpException e) {
        log.debug("Rejected request with {}: {}", e.getStatus(), e.getBody());
        return ResponseEntity.status(e.getStatus())
            .contentType(MediaType.APPLICATION_JSON)
            .body(e.getBody());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError()
            .contentType(MediaType.APPLICATION_JSON)
            .body(JsonRpcErrors.internalError(null));
    }
}
