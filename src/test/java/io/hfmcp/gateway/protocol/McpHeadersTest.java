package io.hfmcp.gateway.protocol;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class McpHeadersTest {

    @Test
    void lowercasesHeadersAndFoldsQueryParameters() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Authorization", "Bearer hf_abc");
        headers.add("X-MCP-Bouquet", "docs");

        Map<String, String> normalized = McpHeaders.normalize(headers,
            Map.of("bouquet", "search", "gradio", "evalstate/flux1_schnell", "other", "x"));

        assertThat(normalized)
            .containsEntry(McpHeaders.AUTHORIZATION, "Bearer hf_abc")
            .containsEntry(McpHeaders.BOUQUET, "search")
            .containsEntry(McpHeaders.GRADIO, "evalstate/flux1_schnell")
            .doesNotContainKey("other");
    }
}
