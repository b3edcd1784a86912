package io.hfmcp.gateway.protocol;

import io.hfmcp.gateway.transport.McpTransport;
import io.hfmcp.gateway.transport.StatelessHttpTransport;
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

import java.util.Map;

/**
 * MCP endpoint for the stateless HTTP transport.
 */
@RestController
@RequestMapping("/mcp")
@ConditionalOnProperty(prefix = "mcp.gateway", name = "transport", havingValue = "stateless-http")
public class StatelessHttpController {

    private final StatelessHttpTransport transport;

    public StatelessHttpController(McpTransport transport) {
        if (!(transport instanceof StatelessHttpTransport stateless)) {
            throw new IllegalStateException("Expected a stateless-http transport but got " + transport.type().value());
        }
        this.transport = stateless;
    }

    @PostMapping
    public ResponseEntity<Object> post(@RequestHeader HttpHeaders headers,
                                       @RequestParam Map<String, String> query,
                                       @RequestBody(required = false) String body) {
        return transport.handlePost(McpHeaders.normalize(headers, query), body);
    }

    @GetMapping
    public ResponseEntity<Object> get(@RequestHeader HttpHeaders headers,
                                      @RequestParam Map<String, String> query) {
        return transport.handleGet(McpHeaders.normalize(headers, query));
    }

    @DeleteMapping
    public ResponseEntity<Object> delete() {
        return transport.handleDelete();
    }
}
