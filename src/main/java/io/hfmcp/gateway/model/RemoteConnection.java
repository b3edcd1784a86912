package io.hfmcp.gateway.model;

import java.util.List;

/**
 * Outcome of discovering one remote endpoint's tools.
 *
 * <p>A successful connection always carries at least one tool.</p>
 */
public record RemoteConnection(
    RemoteEndpoint endpoint,
    int ordinal,
    boolean success,
    List<RemoteToolSpec> tools,
    String error
) {

    public RemoteConnection {
        tools = tools == null ? List.of() : List.copyOf(tools);
        if (success && tools.isEmpty()) {
            throw new IllegalArgumentException("A successful connection must carry at least one tool");
        }
    }

    public static RemoteConnection success(RemoteEndpoint endpoint, int ordinal, List<RemoteToolSpec> tools) {
        return new RemoteConnection(endpoint, ordinal, true, tools, null);
    }

    public static RemoteConnection failure(RemoteEndpoint endpoint, int ordinal, String error) {
        return new RemoteConnection(endpoint, ordinal, false, List.of(), error);
    }
}
