package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.protocol.McpServerInstance;

import java.util.List;

/**
 * Runs after the tools of a specific endpoint were registered on a server being built.
 */
public interface PostRegistrationHook {

    /**
     * Endpoint name ({@code owner/space}) this hook applies to, matched case-insensitively.
     */
    String endpointName();

    /**
     * @param builder the server being built
     * @param connection the endpoint's connection
     * @param registeredToolNames local names of the endpoint's tools just registered
     */
    void afterRegistration(McpServerInstance.Builder builder, RemoteConnection connection, List<String> registeredToolNames);
}
