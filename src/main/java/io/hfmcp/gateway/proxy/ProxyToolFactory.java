package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.client.RemoteToolProvider;
import io.hfmcp.gateway.metrics.RemoteToolMetrics;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;
import io.hfmcp.gateway.model.RemoteToolSpec;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the local descriptor of a proxied tool: title, description, validator and a handler
 * that forwards calls to the remote endpoint.
 */
@Component
public class ProxyToolFactory {

    private static final Logger log = LoggerFactory.getLogger(ProxyToolFactory.class);

    private final RemoteToolProvider provider;
    private final JsonSchemaConverter schemaConverter;
    private final RemoteToolMetrics metrics;

    public ProxyToolFactory(RemoteToolProvider provider, JsonSchemaConverter schemaConverter, GatewayContext context) {
        this.provider = provider;
        this.schemaConverter = schemaConverter;
        this.metrics = context.remoteToolMetrics();
    }

    /**
     * @param toolName the generated local name
     * @param endpoint the resolved endpoint
     * @param spec the remote tool
     * @param token caller token, forwarded only to private endpoints
     * @return the descriptor
     */
    public ToolDescriptor create(String toolName, RemoteEndpoint endpoint, RemoteToolSpec spec, String token) {
        String displayName = endpoint.displayName();
        String emoji = endpoint.emoji() != null && !endpoint.emoji().isBlank() ? " " + endpoint.emoji() : "";
        String title = displayName + " - " + spec.name() + emoji;
        String description = spec.description().isEmpty()
            ? spec.name() + " tool from " + displayName
            : spec.description() + " (from " + displayName + ")";
        String callToken = endpoint.visibility() == Visibility.PRIVATE ? token : null;

        return ToolDescriptor.builder()
            .name(toolName)
            .title(title)
            .description(description)
            .inputSchema(schemaConverter.convertInputSchema(spec.inputSchema()))
            .annotation("openWorldHint", true)
            .annotation("title", title)
            .handler((arguments, context) -> {
                log.info("Calling remote tool {} on {}", spec.name(), endpoint.name());
                try {
                    Map<String, Object> result = provider.callTool(endpoint, spec.name(), arguments, callToken, context);
                    if (ToolResults.isError(result)) {
                        log.warn("Remote tool {} returned an error", toolName);
                        metrics.recordFailure(toolName);
                    } else {
                        metrics.recordSuccess(toolName);
                    }
                    return result;
                } catch (RuntimeException e) {
                    log.error("Remote tool call {} failed: {}", toolName, e.getMessage());
                    metrics.recordFailure(toolName);
                    throw e;
                }
            })
            .build();
    }
}
