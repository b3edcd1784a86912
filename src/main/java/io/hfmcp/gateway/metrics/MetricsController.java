package io.hfmcp.gateway.metrics;

import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.transport.McpTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of transport and proxy tool metrics.
 */
@RestController
@RequestMapping("/api")
@ConditionalOnWebApplication
public class MetricsController {

    private final GatewayContext context;
    private final McpTransport transport;

    public MetricsController(GatewayContext context, McpTransport transport) {
        this.context = context;
        this.transport = transport;
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("transport", transport.type().value());
        body.put("acceptingConnections", transport.isAcceptingConnections());
        body.put("activeConnections", transport.getActiveConnectionCount());
        body.put("metrics", context.transportMetrics().snapshot());
        body.put("remoteTools", context.remoteToolMetrics().snapshot());
        body.put("sessions", transport.getSessions());
        return ResponseEntity.ok(body);
    }
}
