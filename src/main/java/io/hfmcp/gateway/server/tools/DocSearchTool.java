package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Semantic search over the Hugging Face documentation.
 */
@Component
public class DocSearchTool implements LocalTool {

    static final int MAX_RESULTS = 10;

    private final HubApiClient hubApiClient;

    public DocSearchTool(HubApiClient hubApiClient) {
        this.hubApiClient = hubApiClient;
    }

    @Override
    public String id() {
        return ToolIds.DOC_SEARCH;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Hugging Face Documentation Search")
            .description("Search the Hugging Face documentation. Use hf_doc_fetch to read a result in full.")
            .inputSchema(InputSchema.builder()
                .property("query", ParamSchema.string("What to look for"))
                .property("product", ParamSchema.string("Restrict to one product, e.g. transformers or hub").asOptional())
                .build())
            .readOnly()
            .handler((arguments, context) -> search(arguments, token))
            .build();
    }

    private Map<String, Object> search(Map<String, Object> arguments, String token) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("q", arguments.get("query"));
        query.put("product", arguments.get("product"));
        JsonNode results = hubApiClient.getJson("/api/docs/search", query, token);
        if (results == null || !results.isArray() || results.isEmpty()) {
            return ToolResults.text("No documentation found for \"" + arguments.get("query") + "\".");
        }
        StringBuilder text = new StringBuilder();
        int count = 0;
        for (JsonNode result : results) {
            if (count++ >= MAX_RESULTS) {
                break;
            }
            text.append("## ").append(result.path("heading1").asText(result.path("product").asText("Result")))
                .append('\n')
                .append(result.path("url").asText()).append('\n')
                .append(result.path("text").asText()).append("\n\n");
        }
        return ToolResults.text(text.toString().trim());
    }
}
