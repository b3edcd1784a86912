package io.hfmcp.gateway.transport;

import io.hfmcp.gateway.protocol.McpHeaders;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BrowserDetectionTest {

    @Test
    void recognisesBrowserNavigation() {
        assertThat(BrowserDetection.isBrowser(Map.of(McpHeaders.ACCEPT, "text/html,*/*;q=0.8"))).isTrue();
    }

    @Test
    void mcpClientsAreNotBrowsers() {
        assertThat(BrowserDetection.isBrowser(Map.of(McpHeaders.ACCEPT, "application/json, text/event-stream"))).isFalse();
        assertThat(BrowserDetection.isBrowser(Map.of(McpHeaders.ACCEPT, "*/*, application/json"))).isFalse();
        assertThat(BrowserDetection.isBrowser(Map.of())).isFalse();
    }
}
