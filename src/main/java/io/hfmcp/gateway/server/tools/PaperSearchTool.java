package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Searches papers indexed on the Hub.
 */
@Component
public class PaperSearchTool implements LocalTool {

    static final int DEFAULT_RESULTS = 12;
    static final int SUMMARY_LENGTH = 400;

    private final HubApiClient hubApiClient;

    public PaperSearchTool(HubApiClient hubApiClient) {
        this.hubApiClient = hubApiClient;
    }

    @Override
    public String id() {
        return ToolIds.PAPER_SEARCH;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Paper Search")
            .description("Find machine learning research papers on the Hugging Face Hub.")
            .inputSchema(InputSchema.builder()
                .property("query", ParamSchema.string("Semantic search query"))
                .property("results_limit", ParamSchema.number("Number of results to return").withDefault(DEFAULT_RESULTS))
                .build())
            .readOnly()
            .handler((arguments, context) -> search(arguments, token))
            .build();
    }

    private Map<String, Object> search(Map<String, Object> arguments, String token) {
        String query = (String) arguments.get("query");
        int limit = Math.max(1, ((Number) arguments.get("results_limit")).intValue());
        JsonNode results = hubApiClient.getJson("/api/papers/search", Map.of("q", query), token);
        if (results == null || !results.isArray() || results.isEmpty()) {
            return ToolResults.text("No papers found for \"" + query + "\".");
        }
        StringBuilder text = new StringBuilder();
        int count = 0;
        for (JsonNode result : results) {
            if (count++ >= limit) {
                break;
            }
            JsonNode paper = result.has("paper") ? result.get("paper") : result;
            String id = paper.path("id").asText();
            text.append("## ").append(paper.path("title").asText(result.path("title").asText(id))).append('\n');
            text.append("https://huggingface.co/papers/").append(id).append('\n');
            String summary = paper.path("summary").asText("");
            if (!summary.isEmpty()) {
                text.append(summary.length() > SUMMARY_LENGTH ? summary.substring(0, SUMMARY_LENGTH) + "..." : summary).append('\n');
            }
            text.append('\n');
        }
        return ToolResults.text(text.toString().trim());
    }
}
