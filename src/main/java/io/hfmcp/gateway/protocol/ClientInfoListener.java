package io.hfmcp.gateway.protocol;

import io.hfmcp.gateway.model.ClientInfo;

/**
 * Receives the client identity and capabilities once the initialize handshake completes.
 */
@FunctionalInterface
public interface ClientInfoListener {

    ClientInfoListener NONE = (clientInfo, sampling, roots) -> {
    };

    void onInitialized(ClientInfo clientInfo, boolean sampling, boolean roots);
}
