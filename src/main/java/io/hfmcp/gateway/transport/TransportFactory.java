package io.hfmcp.gateway.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.server.ServerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Builds the transport selected in configuration.
 */
public class TransportFactory {

    private final ServerFactory serverFactory;
    private final GatewayContext context;
    private final ObjectMapper objectMapper;
    private final TaskScheduler scheduler;
    private final GatewayProperties properties;

    public TransportFactory(ServerFactory serverFactory,
                            GatewayContext context,
                            ObjectMapper objectMapper,
                            TaskScheduler scheduler,
                            GatewayProperties properties) {
        this.serverFactory = serverFactory;
        this.context = context;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    public McpTransport create(TransportType type) {
        return switch (type) {
            case STDIO -> new StdioTransport(serverFactory, context, objectMapper, System.in, System.out);
            case SSE -> new SseTransport(serverFactory, context, objectMapper, scheduler, properties.getSession());
            case STREAMABLE_HTTP -> new StreamableHttpTransport(
                serverFactory, context, objectMapper, scheduler, properties.getSession());
            case STATELESS_HTTP -> new StatelessHttpTransport(serverFactory, context, objectMapper,
                properties.isStrictCompliance(), properties.getServerName(), properties.getServerVersion());
        };
    }
}
