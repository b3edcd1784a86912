package io.hfmcp.gateway.protocol;

import io.hfmcp.gateway.transport.McpTransport;
import io.hfmcp.gateway.transport.SseTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * Endpoints of the legacy SSE transport: the event stream and the message sink.
 */
@RestController
@ConditionalOnProperty(prefix = "mcp.gateway", name = "transport", havingValue = "sse")
public class SseController {

    private final SseTransport transport;

    public SseController(McpTransport transport) {
        if (!(transport instanceof SseTransport sse)) {
            throw new IllegalStateException("Expected an sse transport but got " + transport.type().value());
        }
        this.transport = sse;
    }

    @GetMapping("/sse")
    public SseEmitter connect(@RequestHeader HttpHeaders headers,
                              @RequestParam Map<String, String> query) {
        return transport.connect(McpHeaders.normalize(headers, query), query.get("sessionId"));
    }

    @PostMapping(SseTransport.MESSAGE_ENDPOINT)
    public ResponseEntity<Object> message(@RequestHeader HttpHeaders headers,
                                          @RequestParam Map<String, String> query,
                                          @RequestBody(required = false) String body) {
        return transport.handleMessage(query.get("sessionId"), McpHeaders.normalize(headers, query), body);
    }
}
