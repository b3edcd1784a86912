package io.hfmcp.gateway.transport;

import io.hfmcp.gateway.protocol.McpHeaders;

import java.util.Locale;
import java.util.Map;

/**
 * Tells a browser navigation apart from an MCP client probing the endpoint.
 */
public final class BrowserDetection {

    private BrowserDetection() {
    }

    /**
     * A request is treated as coming from a browser when it accepts anything ({@code *}{@code /*})
     * but names neither an event stream nor JSON.
     *
     * @param headers normalised request headers
     * @return true for a browser navigation
     */
    public static boolean isBrowser(Map<String, String> headers) {
        String accept = headers.get(McpHeaders.ACCEPT);
        if (accept == null) {
            return false;
        }
        String value = accept.toLowerCase(Locale.ROOT);
        return value.contains("*/*")
            && !value.contains("text/event-stream")
            && !value.contains("application/json");
    }
}
