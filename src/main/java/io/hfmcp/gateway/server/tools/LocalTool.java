package io.hfmcp.gateway.server.tools;

import io.hfmcp.gateway.protocol.ToolDescriptor;

/**
 * A tool implemented by the gateway itself on top of the Hub API.
 */
public interface LocalTool {

    /**
     * Tool id, also the registered tool name.
     */
    String id();

    /**
     * Build the descriptor bound to a caller's token.
     *
     * @param token caller token, may be null
     */
    ToolDescriptor descriptor(String token);
}
