package io.hfmcp.gateway.server.tools;

import io.hfmcp.gateway.client.HubApiClient;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.InvalidParamsException;
import io.hfmcp.gateway.protocol.ParamSchema;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fetches a Hugging Face documentation page, in chunks.
 *
 * <p>Only URLs under {@code https://huggingface.co/docs/} are accepted.</p>
 */
@Component
public class DocFetchTool implements LocalTool {

    static final String DOCS_PREFIX = "https://huggingface.co/docs/";
    static final int CHUNK_SIZE = 7500;

    private final HubApiClient hubApiClient;

    public DocFetchTool(HubApiClient hubApiClient) {
        this.hubApiClient = hubApiClient;
    }

    @Override
    public String id() {
        return ToolIds.DOC_FETCH;
    }

    @Override
    public ToolDescriptor descriptor(String token) {
        return ToolDescriptor.builder()
            .name(id())
            .title("Fetch Hugging Face Documentation")
            .description("Fetch a documentation page from " + DOCS_PREFIX + ". Long pages are returned in chunks; "
                + "pass the offset from the previous response to continue.")
            .inputSchema(InputSchema.builder()
                .property("doc_url", ParamSchema.string("Documentation URL starting with " + DOCS_PREFIX))
                .property("offset", ParamSchema.number("Character offset to continue from").withDefault(0))
                .build())
            .readOnly()
            .handler((arguments, context) -> fetch(arguments, token))
            .build();
    }

    Map<String, Object> fetch(Map<String, Object> arguments, String token) {
        String url = (String) arguments.get("doc_url");
        if (!url.startsWith(DOCS_PREFIX)) {
            throw new InvalidParamsException("Invalid arguments: doc_url must start with " + DOCS_PREFIX);
        }
        int offset = Math.max(0, ((Number) arguments.get("offset")).intValue());
        String page = hubApiClient.getText(url, token);
        if (offset >= page.length()) {
            return ToolResults.text(offset == 0 ? "The page is empty." : "No content after offset " + offset + ".");
        }
        int end = Math.min(page.length(), offset + CHUNK_SIZE);
        String chunk = page.substring(offset, end);
        if (end < page.length()) {
            chunk += "\n\n[Content truncated. Call again with offset " + end + " to continue.]";
        }
        return ToolResults.text(chunk);
    }
}
