package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.protocol.McpHeaders;

import java.util.Map;

/**
 * Selection-relevant values extracted from normalised request headers.
 *
 * @param token bearer token from the request, else the configured default token; null when neither
 * @param bouquet requested bouquet override
 * @param mix requested bouquet to mix into the user's settings
 * @param gradio comma-separated remote endpoint names, or {@code none}
 * @param forceAuth whether the client asked for authentication to be enforced
 */
public record RequestContext(
    String token,
    String bouquet,
    String mix,
    String gradio,
    boolean forceAuth
) {

    private static final String BEARER_PREFIX = "bearer ";

    public static RequestContext from(Map<String, String> headers, String defaultToken) {
        String token = bearerToken(headers.get(McpHeaders.AUTHORIZATION));
        if (token == null) {
            token = blankToNull(defaultToken);
        }
        return new RequestContext(
            token,
            blankToNull(headers.get(McpHeaders.BOUQUET)),
            blankToNull(headers.get(McpHeaders.MIX)),
            blankToNull(headers.get(McpHeaders.GRADIO)),
            "true".equalsIgnoreCase(headers.get(McpHeaders.FORCE_AUTH)));
    }

    /**
     * The request explicitly disabled remote tools with {@code gradio=none}.
     */
    public boolean gradioDisabled() {
        return "none".equalsIgnoreCase(gradio);
    }

    private static String bearerToken(String authorization) {
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()
            || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return blankToNull(authorization.substring(BEARER_PREFIX.length()).trim());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
