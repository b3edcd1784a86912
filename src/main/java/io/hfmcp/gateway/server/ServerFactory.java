package io.hfmcp.gateway.server;

import io.hfmcp.gateway.protocol.McpServerInstance;

/**
 * Builds a sealed MCP server instance with the tools selected for a request.
 */
@FunctionalInterface
public interface ServerFactory {

    McpServerInstance create(ServerRequest request);
}
