package io.hfmcp.gateway.server.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports which Hugging Face account the request is authenticated as.
 */
@Component
public class WhoAmITool implements LocalTool {

    static final String ANONYMOUS_TEXT = "You are not authenticated. Provide a Hugging Face token with "
        + "'Authorization: Bearer <token>' to access private resources and higher rate limits.";

    private final HubApiClient hubApiClient;

    public WhoAmITool(HubApiClient hubApiClient) {
        this.hubApiClient = hubApiClient;
    }

    @Override
    public String id() {
        return ToolIds.WHOAMI;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Hugging Face User Info")
            .description("Hugging Face tools are being used by the authenticated user. Returns the username and organizations.")
            .readOnly()
            .handler((arguments, context) -> {
                if (token == null) {
                    return ToolResults.text(ANONYMOUS_TEXT);
                }
                JsonNode user = hubApiClient.getJson("/api/whoami-v2", null, token);
                List<String> orgs = new ArrayList<>();
                user.path("orgs").forEach(org -> orgs.add(org.path("name").asText()));
                StringBuilder text = new StringBuilder("You are authenticated as ")
                    .append(user.path("name").asText("unknown"));
                if (!orgs.isEmpty()) {
                    text.append(" (organizations: ").append(String.join(", ", orgs)).append(')');
                }
                return ToolResults.text(text.toString());
            })
            .build();
    }
}
