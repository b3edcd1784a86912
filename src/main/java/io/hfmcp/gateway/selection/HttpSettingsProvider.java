package io.hfmcp.gateway.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.model.AppSettings;
import io.hfmcp.gateway.model.RemoteEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches per-user settings from an external settings service.
 *
 * <p>Expects {@code {builtInTools: [...], spaceTools: [{_id, name, subdomain, emoji}]}}. Any
 * failure, including a timeout of the underlying client, yields null.</p>
 */
public class HttpSettingsProvider implements SettingsProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpSettingsProvider.class);

    static final String DEFAULT_EMOJI = "🛠️";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String settingsUrl;

    public HttpSettingsProvider(RestTemplate restTemplate, ObjectMapper objectMapper, String settingsUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settingsUrl = settingsUrl;
    }

    @Override
    public AppSettings getSettings(String token) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (token != null) {
                headers.setBearerAuth(token);
            }
            log.debug("Fetching external settings from {}", settingsUrl);
            ResponseEntity<String> response = restTemplate.exchange(
                settingsUrl, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            if (response.getBody() == null) {
                log.warn("External settings response from {} had no body", settingsUrl);
                return null;
            }
            return parse(objectMapper.readTree(response.getBody()));
        } catch (Exception e) {
            log.warn("Failed to fetch external settings from {}: {}", settingsUrl, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isExternal() {
        return true;
    }

    AppSettings parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("Ignoring external settings: expected a JSON object");
            return null;
        }
        List<String> builtInTools = new ArrayList<>();
        root.path("builtInTools").forEach(node -> {
            if (node.isTextual()) {
                builtInTools.add(node.asText());
            }
        });
        List<RemoteEndpoint> spaceTools = new ArrayList<>();
        root.path("spaceTools").forEach(node -> {
            String name = node.path("name").asText(null);
            if (name == null) {
                return;
            }
            spaceTools.add(RemoteEndpoint.builder()
                .id(node.path("_id").asText(name))
                .name(name)
                .subdomain(node.path("subdomain").asText(null))
                .emoji(node.path("emoji").asText(DEFAULT_EMOJI))
                .build());
        });
        return new AppSettings(builtInTools, spaceTools);
    }
}
