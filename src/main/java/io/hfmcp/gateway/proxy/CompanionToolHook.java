package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Adds a static text tool next to the tools of one endpoint, e.g. usage notes for a Space.
 */
public class CompanionToolHook implements PostRegistrationHook {

    private static final Logger log = LoggerFactory.getLogger(CompanionToolHook.class);

    private final String endpointName;
    private final String toolName;
    private final String description;
    private final String text;

    public CompanionToolHook(String endpointName, String toolName, String description, String text) {
        this.endpointName = endpointName;
        this.toolName = toolName;
        this.description = description;
        this.text = text;
    }

    @Override
    public String endpointName() {
        return endpointName;
    }

    @Override
    public void afterRegistration(McpServerInstance.Builder builder, RemoteConnection connection,
                                  List<String> registeredToolNames) {
        if (builder.hasTool(toolName)) {
            log.debug("Companion tool {} already registered", toolName);
            return;
        }
        builder.tool(ToolDescriptor.builder()
            .name(toolName)
            .description(description)
            .annotation("readOnlyHint", true)
            .handler((arguments, context) -> ToolResults.text(text))
            .build());
        log.debug("Registered companion tool {} for {}", toolName, endpointName);
    }
}
