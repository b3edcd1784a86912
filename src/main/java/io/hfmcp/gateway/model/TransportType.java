package io.hfmcp.gateway.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Wire mechanisms the gateway can serve MCP over.
 */
public enum TransportType {
    STDIO("stdio"),
    SSE("sse"),
    STREAMABLE_HTTP("streamable-http"),
    STATELESS_HTTP("stateless-http");

    private final String value;

    TransportType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a configured transport name.
     *
     * @param value the configured name, e.g. "streamable-http"
     * @return the transport type
     * @throws IllegalStateException if the name is not a supported transport
     */
    public static TransportType fromValue(String value) {
        if (value == null) {
            throw new IllegalStateException("No transport type configured");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.value.equals(normalized) || type.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Unsupported transport type: " + value));
    }

    public boolean isStateful() {
        return this == SSE || this == STREAMABLE_HTTP;
    }
}
