package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.InvalidParamsException;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shows details of one or more Hub repositories.
 */
@Component
public class RepoDetailsTool implements LocalTool {

    static final int MAX_REPOS = 10;
    private static final Set<String> REPO_TYPES = Set.of("model", "dataset", "space");

    private final HubApiClient hubApiClient;

    public RepoDetailsTool(HubApiClient hubApiClient) {
        this.hubApiClient = hubApiClient;
    }

    @Override
    public String id() {
        return ToolIds.REPO_DETAILS;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Hub Repository Details")
            .description("Get details for models, datasets or Spaces on the Hugging Face Hub.")
            .inputSchema(InputSchema.builder()
                .property("repo_ids", ParamSchema.of(ParamSchema.Type.ARRAY)
                    .withDescription("Repository ids in owner/name form (max " + MAX_REPOS + ")"))
                .property("repo_type", ParamSchema.string("One of model, dataset, space").withDefault("model"))
                .build())
            .readOnly()
            .handler((arguments, context) -> details(arguments, token))
            .build();
    }

    private Map<String, Object> details(Map<String, Object> arguments, String token) {
        String repoType = (String) arguments.get("repo_type");
        if (!REPO_TYPES.contains(repoType)) {
            throw new InvalidParamsException("Invalid arguments: repo_type must be one of " + REPO_TYPES);
        }
        List<?> repoIds = (List<?>) arguments.get("repo_ids");
        if (repoIds.isEmpty() || repoIds.size() > MAX_REPOS) {
            throw new InvalidParamsException("Invalid arguments: provide between 1 and " + MAX_REPOS + " repo_ids");
        }
        StringBuilder text = new StringBuilder();
        for (Object repoId : repoIds) {
            String id = String.valueOf(repoId);
            try {
                JsonNode info = hubApiClient.getJson("/api/" + repoType + "s/" + id, null, token);
                text.append(format(repoType, id, info));
            } catch (RestClientException e) {
                text.append("# ").append(id).append("\nCould not load details: ").append(e.getMessage()).append("\n\n");
            }
        }
        return ToolResults.text(text.toString().trim());
    }

    private static String format(String repoType, String id, JsonNode info) {
        StringBuilder text = new StringBuilder("# ").append(id).append(" (").append(repoType).append(")\n");
        appendField(text, "Author", info.path("author"));
        appendField(text, "Downloads", info.path("downloads"));
        appendField(text, "Likes", info.path("likes"));
        appendField(text, "Pipeline", info.path("pipeline_tag"));
        appendField(text, "Library", info.path("library_name"));
        appendField(text, "SDK", info.path("sdk"));
        appendField(text, "Last modified", info.path("lastModified"));
        if (info.path("tags").isArray() && !info.path("tags").isEmpty()) {
            StringBuilder tags = new StringBuilder();
            info.path("tags").forEach(tag -> tags.append(tags.length() > 0 ? ", " : "").append(tag.asText()));
            text.append("- Tags: ").append(tags).append('\n');
        }
        String prefix = "model".equals(repoType) ? "" : repoType + "s/";
        text.append("- URL: https://huggingface.co/").append(prefix).append(id).append("\n\n");
        return text.toString();
    }

    private static void appendField(StringBuilder text, String label, JsonNode value) {
        if (!value.isMissingNode() && !value.isNull()) {
            text.append("- ").append(label).append(": ").append(value.asText()).append('\n');
        }
    }
}
