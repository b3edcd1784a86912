package io.hfmcp.gateway.server;

import io.hfmcp.gateway.model.AppSettings;
import io.hfmcp.gateway.protocol.ClientInfoListener;

import java.util.Map;

/**
 * Everything the server factory needs to build a server instance for one session or request.
 *
 * @param headers normalised request headers
 * @param settings caller-supplied settings, or null to consult the settings provider
 * @param augmentation requested augmentation policy
 * @param clientInfoListener receives the client identity at initialize
 */
public record ServerRequest(
    Map<String, String> headers,
    AppSettings settings,
    AugmentationPolicy augmentation,
    ClientInfoListener clientInfoListener
) {

    public ServerRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        augmentation = augmentation == null ? AugmentationPolicy.ALWAYS : augmentation;
        clientInfoListener = clientInfoListener == null ? ClientInfoListener.NONE : clientInfoListener;
    }

    public static ServerRequest of(Map<String, String> headers, AugmentationPolicy augmentation,
                                   ClientInfoListener clientInfoListener) {
        return new ServerRequest(headers, null, augmentation, clientInfoListener);
    }
}
