package io.hfmcp.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.hfmcp.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Thin client for the Hugging Face Hub HTTP API.
 *
 * <p>The caller's token is passed through untouched. HTTP failures surface as
 * {@link org.springframework.web.client.RestClientException}.</p>
 */
@Service
public class HubApiClient {

    private static final Logger log = LoggerFactory.getLogger(HubApiClient.class);

    private final RestTemplate restTemplate;
    private final String hubUrl;

    public HubApiClient(RestTemplate restTemplate, GatewayProperties properties) {
        this.restTemplate = restTemplate;
        this.hubUrl = properties.getHubUrl();
    }

    /**
     * GET a JSON document from the Hub.
     *
     * @param path API path, e.g. {@code /api/models}
     * @param query query parameters; null values are omitted
     * @param token caller token, may be null
     * @return the parsed document
     */
    public JsonNode getJson(String path, Map<String, ?> query, String token) {
        URI uri = uri(path, query);
        log.debug("GET {}", uri);
        ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET,
            new HttpEntity<>(headers(token, MediaType.APPLICATION_JSON)), JsonNode.class);
        return response.getBody();
    }

    /**
     * POST a JSON body to the Hub.
     */
    public JsonNode postJson(String path, Object body, String token) {
        URI uri = uri(path, null);
        log.debug("POST {}", uri);
        HttpHeaders headers = headers(token, MediaType.APPLICATION_JSON);
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.POST,
            new HttpEntity<>(body, headers), JsonNode.class);
        return response.getBody();
    }

    /**
     * GET a text document from an absolute URL.
     */
    public String getText(String url, String token) {
        log.debug("GET {}", url);
        ResponseEntity<String> response = restTemplate.exchange(URI.create(url), HttpMethod.GET,
            new HttpEntity<>(headers(token, MediaType.ALL)), String.class);
        return response.getBody() != null ? response.getBody() : "";
    }

    public String getHubUrl() {
        return hubUrl;
    }

    URI uri(String path, Map<String, ?> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(hubUrl).path(path);
        if (query != null) {
            query.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.encode().build().toUri();
    }

    private static HttpHeaders headers(String token, MediaType accept) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(accept));
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}
