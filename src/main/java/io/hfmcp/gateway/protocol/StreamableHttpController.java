package io.hfmcp.gateway.protocol;

import io.hfmcp.gateway.transport.McpTransport;
import io.hfmcp.gateway.transport.StreamableHttpTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * MCP endpoint for the session-oriented streamable HTTP transport.
 */
@RestController
@RequestMapping("/mcp")
@ConditionalOnProperty(prefix = "mcp.gateway", name = "transport", havingValue = "streamable-http", matchIfMissing = true)
public class StreamableHttpController {

    private final StreamableHttpTransport transport;

    public StreamableHttpController(McpTransport transport) {
        if (!(transport instanceof StreamableHttpTransport streamable)) {
            throw new IllegalStateException("Expected a streamable-http transport but got " + transport.type().value());
        }
        this.transport = streamable;
    }

    @PostMapping
    public ResponseEntity<Object> post(@RequestHeader HttpHeaders headers,
                                       @RequestParam Map<String, String> query,
                                       @RequestBody(required = false) String body) {
        return transport.handlePost(McpHeaders.normalize(headers, query), body);
    }

    @GetMapping
    public SseEmitter stream(@RequestHeader HttpHeaders headers,
                             @RequestParam Map<String, String> query) {
        return transport.handleGet(McpHeaders.normalize(headers, query));
    }

    @DeleteMapping
    public ResponseEntity<Object> delete(@RequestHeader HttpHeaders headers,
                                         @RequestParam Map<String, String> query) {
        return transport.handleDelete(McpHeaders.normalize(headers, query));
    }
}
