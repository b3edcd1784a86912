package io.hfmcp.gateway.transport;

import io.hfmcp.gateway.protocol.ClientInfoListener;

/**
 * Callbacks a transport reports to.
 *
 * @param clientInfoListener notified once a client completes initialize
 * @param onClose invoked when the transport's input ends on its own (stdin EOF)
 */
public record TransportOptions(ClientInfoListener clientInfoListener, Runnable onClose) {

    public TransportOptions {
        clientInfoListener = clientInfoListener == null ? ClientInfoListener.NONE : clientInfoListener;
        onClose = onClose == null ? () -> { } : onClose;
    }

    public static TransportOptions defaults() {
        return new TransportOptions(ClientInfoListener.NONE, null);
    }
}
