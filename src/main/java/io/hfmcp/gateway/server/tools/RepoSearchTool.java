package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Searches one kind of Hub repository (models, datasets or Spaces).
 */
public class RepoSearchTool implements LocalTool {

    /**
     * Repository kinds with their tool id and listing endpoint.
     */
    public enum RepoKind {
        MODEL(ToolIds.MODEL_SEARCH, "models", "downloads"),
        DATASET(ToolIds.DATASET_SEARCH, "datasets", "downloads"),
        SPACE(ToolIds.SPACE_SEARCH, "spaces", "likes");

        private final String toolId;
        private final String path;
        private final String sort;

        RepoKind(String toolId, String path, String sort) {
            this.toolId = toolId;
            this.path = path;
            this.sort = sort;
        }
    }

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final HubApiClient hubApiClient;
    private final RepoKind kind;

    public RepoSearchTool(HubApiClient hubApiClient, RepoKind kind) {
        this.hubApiClient = hubApiClient;
        this.kind = kind;
    }

    @Override
    public String id() {
        return kind.toolId;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        InputSchema schema = InputSchema.builder()
            .property("query", ParamSchema.string("Search terms").asOptional())
            .property("author", ParamSchema.string("Filter by owner (user or organization)").asOptional())
            .property("limit", ParamSchema.number("Maximum number of results").withDefault(DEFAULT_LIMIT))
            .build();
        return ToolDescriptor.builder()
            .name(id())
            .title(capitalize(kind.path) + " Search")
            .description("Find " + kind.path + " on the Hugging Face Hub. Results are sorted by " + kind.sort + ".")
            .inputSchema(schema)
            .readOnly()
            .handler((arguments, context) -> search(arguments, token))
            .build();
    }

    private Map<String, Object> search(Map<String, Object> arguments, String token) {
        int limit = Math.max(1, Math.min(MAX_LIMIT, ((Number) arguments.get("limit")).intValue()));
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("search", arguments.get("query"));
        query.put("author", arguments.get("author"));
        query.put("sort", kind.sort);
        query.put("direction", -1);
        query.put("limit", limit);

        JsonNode results = hubApiClient.getJson("/api/" + kind.path, query, token);
        if (results == null || !results.isArray() || results.isEmpty()) {
            return ToolResults.text("No " + kind.path + " found.");
        }
        StringBuilder text = new StringBuilder("Found ").append(results.size()).append(' ').append(kind.path).append(":\n\n");
        for (JsonNode repo : results) {
            text.append("- ").append(repo.path("id").asText());
            if (repo.has(kind.sort)) {
                text.append(" (").append(kind.sort).append(": ").append(repo.path(kind.sort).asLong()).append(')');
            }
            if (repo.hasNonNull("pipeline_tag")) {
                text.append(" [").append(repo.path("pipeline_tag").asText()).append(']');
            }
            text.append('\n');
        }
        return ToolResults.text(text.toString());
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
