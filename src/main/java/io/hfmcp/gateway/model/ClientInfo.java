package io.hfmcp.gateway.model;

/**
 * Client identity reported in the MCP initialize handshake.
 */
public record ClientInfo(
    String name,
    String version
) {

    /**
     * Key used to aggregate metrics per client identity.
     */
    public String key() {
        return name + " " + version;
    }
}
