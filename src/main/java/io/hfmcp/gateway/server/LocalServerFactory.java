package io.hfmcp.gateway.server;

import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.ToolSelectionResult;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.selection.RequestContext;
import io.hfmcp.gateway.selection.ToolSelectionStrategy;
import io.hfmcp.gateway.server.tools.LocalTool;
import io.hfmcp.gateway.server.tools.LocalToolCatalog;
import io.hfmcp.gateway.server.tools.ToolIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * First stage of server construction: tool selection and local tool registration.
 *
 * <p>{@code hf_whoami} is always registered; every other enabled tool id known to the catalog is
 * registered bound to the request token. Unknown ids are skipped.</p>
 */
@Service
public class LocalServerFactory {

    private static final Logger log = LoggerFactory.getLogger(LocalServerFactory.class);

    static final String INSTRUCTIONS = "You have tools for searching and inspecting the Hugging Face Hub "
        + "(models, datasets, Spaces, papers and documentation). Tools prefixed gr or grp run on Gradio Spaces.";

    private final ToolSelectionStrategy selectionStrategy;
    private final LocalToolCatalog catalog;
    private final GatewayProperties properties;

    public LocalServerFactory(ToolSelectionStrategy selectionStrategy, LocalToolCatalog catalog,
                              GatewayProperties properties) {
        this.selectionStrategy = selectionStrategy;
        this.catalog = catalog;
        this.properties = properties;
    }

    /**
     * Select tools for the request and register the local ones on a fresh builder.
     *
     * @param request the server request
     * @return the unsealed builder together with the selection it was built from
     */
    public Composition compose(ServerRequest request) {
        RequestContext context = RequestContext.from(request.headers(), properties.getDefaultToken());
        ToolSelectionResult selection = selectionStrategy.selectTools(request.headers(), request.settings(), context.token());
        log.debug("Tool selection: mode={} reason={}", selection.mode(), selection.reason());

        McpServerInstance.Builder builder = McpServerInstance.builder()
            .serverInfo(properties.getServerName(), properties.getServerVersion())
            .instructions(INSTRUCTIONS)
            .clientInfoListener(request.clientInfoListener());

        catalog.find(ToolIds.WHOAMI).ifPresent(tool -> builder.tool(tool.descriptor(context.token())));
        for (String id : selection.enabledToolIds()) {
            if (ToolIds.WHOAMI.equals(id) || builder.hasTool(id)) {
                continue;
            }
            Optional<LocalTool> tool = catalog.find(id);
            if (tool.isPresent()) {
                builder.tool(tool.get().descriptor(context.token()));
            } else {
                log.debug("Skipping unknown tool id {}", id);
            }
        }
        return new Composition(builder, selection, context);
    }

    /**
     * A builder with local tools registered, plus what is needed to add remote tools.
     */
    public record Composition(
        McpServerInstance.Builder builder,
        ToolSelectionResult selection,
        RequestContext context
    ) {
    }
}
