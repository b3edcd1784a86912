package io.hfmcp.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.protocol.ToolCallContext;

import java.util.Map;

/**
 * Access to the tools of remote compute endpoints.
 */
public interface RemoteToolProvider {

    /**
     * Fetch the raw tool schema document of an endpoint.
     *
     * @param endpoint the endpoint
     * @param token token to send, or null for public endpoints
     * @return the schema document
     * @throws RemoteToolException if the endpoint cannot be reached or returns malformed JSON
     */
    JsonNode fetchSchema(RemoteEndpoint endpoint, String token);

    /**
     * Call a tool on an endpoint, forwarding progress and log notifications to the caller.
     *
     * @param endpoint the endpoint
     * @param toolName the remote (unprefixed) tool name
     * @param arguments validated arguments
     * @param token token to send, or null for public endpoints
     * @param context the local call context
     * @return the remote {@code tools/call} result
     * @throws RemoteToolException if the call fails at transport or protocol level
     */
    Map<String, Object> callTool(RemoteEndpoint endpoint, String toolName, Map<String, Object> arguments,
                                 String token, ToolCallContext context);
}
