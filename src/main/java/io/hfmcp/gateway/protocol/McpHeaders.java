package io.hfmcp.gateway.protocol;

import org.springframework.http.HttpHeaders;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Header names understood by the gateway and the flattening of inbound HTTP headers.
 */
public final class McpHeaders {

    public static final String SESSION_ID = "mcp-session-id";
    public static final String BOUQUET = "x-mcp-bouquet";
    public static final String MIX = "x-mcp-mix";
    public static final String GRADIO = "x-mcp-gradio";
    public static final String FORCE_AUTH = "x-mcp-force-auth";
    public static final String AUTHORIZATION = "authorization";
    public static final String USER_AGENT = "user-agent";
    public static final String ACCEPT = "accept";
    public static final String LAST_EVENT_ID = "last-event-id";

    private static final Map<String, String> QUERY_PARAMETER_HEADERS = Map.of(
        "bouquet", BOUQUET,
        "mix", MIX,
        "gradio", GRADIO,
        "forceauth", FORCE_AUTH);

    private McpHeaders() {
    }

    /**
     * Flatten request headers to lower-cased single values and fold the {@code bouquet},
     * {@code mix}, {@code gradio} and {@code forceauth} query parameters into their
     * {@code x-mcp-*} headers. A query parameter takes precedence over the header.
     *
     * @param headers inbound HTTP headers
     * @param queryParameters inbound query parameters, may be null
     * @return flattened headers
     */
    public static Map<String, String> normalize(HttpHeaders headers, Map<String, String> queryParameters) {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (values != null && !values.isEmpty()) {
                    normalized.put(name.toLowerCase(Locale.ROOT), values.get(0));
                }
            });
        }
        if (queryParameters != null) {
            QUERY_PARAMETER_HEADERS.forEach((parameter, header) -> {
                String value = queryParameters.get(parameter);
                if (value != null) {
                    normalized.put(header, value);
                }
            });
        }
        return normalized;
    }
}
