package io.hfmcp.gateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpHeaders;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.protocol.ToolCallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client for Gradio Space MCP endpoints.
 *
 * <p>Schemas come from {@code /gradio_api/mcp/schema}. Tool calls open a short-lived MCP
 * streaming-HTTP session at {@code /gradio_api/mcp/} ({@code initialize},
 * {@code notifications/initialized}, {@code tools/call}) and close it afterwards. Calls are
 * never retried.</p>
 */
@Service
public class GradioRemoteClient implements RemoteToolProvider {

    private static final Logger log = LoggerFactory.getLogger(GradioRemoteClient.class);

    static final String SCHEMA_PATH = "/gradio_api/mcp/schema";
    static final String MCP_PATH = "/gradio_api/mcp/";

    private final RestTemplate schemaRestTemplate;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final McpEventStreamReader eventStreamReader;
    private final String urlTemplate;
    private final String clientName;
    private final String clientVersion;
    private final AtomicLong requestIds = new AtomicLong();

    @Autowired
    public GradioRemoteClient(@Qualifier("schemaRestTemplate") RestTemplate schemaRestTemplate,
                              @Qualifier("remoteRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              GatewayProperties properties) {
        this.schemaRestTemplate = schemaRestTemplate;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.eventStreamReader = new McpEventStreamReader(objectMapper);
        this.urlTemplate = properties.getRemote().getUrlTemplate();
        this.clientName = properties.getServerName();
        this.clientVersion = properties.getServerVersion();
    }

    @Override
    public JsonNode fetchSchema(RemoteEndpoint endpoint, String token) {
        String url = baseUrl(endpoint) + SCHEMA_PATH;
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (token != null) {
            headers.setBearerAuth(token);
        }
        log.debug("Fetching schema for {} from {}", endpoint.name(), url);
        try {
            ResponseEntity<String> response = schemaRestTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new RemoteToolException("Empty schema response from " + endpoint.name());
            }
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteToolException("Malformed schema JSON from " + endpoint.name(), e);
        } catch (RestClientException e) {
            throw new RemoteToolException("Schema fetch failed for " + endpoint.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> callTool(RemoteEndpoint endpoint, String toolName, Map<String, Object> arguments,
                                        String token, ToolCallContext context) {
        URI uri = URI.create(baseUrl(endpoint) + MCP_PATH);
        String sessionId = initialize(uri, token);
        try {
            post(uri, token, sessionId, JsonRpcMessage.request(null, "notifications/initialized", null), null, context);

            Map<String, Object> params = new LinkedHashMap<>();
            params.put("name", toolName);
            params.put("arguments", arguments);
            if (context.progressToken() != null) {
                params.put("_meta", Map.of("progressToken", context.progressToken()));
            }
            long id = requestIds.incrementAndGet();
            RemoteReply reply = post(uri, token, sessionId, JsonRpcMessage.request(id, "tools/call", params), id, context);
            JsonRpcMessage response = reply.message();
            if (response == null) {
                throw new RemoteToolException("No response from " + endpoint.name() + " for tool " + toolName);
            }
            if (response.error() != null) {
                throw new RemoteToolException("Remote error from " + endpoint.name() + ": " + response.error().get("message"));
            }
            return response.result() != null ? response.result() : Map.of("content", List.of());
        } finally {
            closeSession(uri, token, sessionId);
        }
    }

    private String initialize(URI uri, String token) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", McpServerInstance.LATEST_PROTOCOL_VERSION);
        params.put("capabilities", Map.of());
        params.put("clientInfo", Map.of("name", clientName, "version", clientVersion));
        long id = requestIds.incrementAndGet();
        RemoteReply reply = post(uri, token, null, JsonRpcMessage.request(id, "initialize", params), id, null);
        if (reply.message() == null || reply.message().error() != null) {
            throw new RemoteToolException("Initialize failed at " + uri);
        }
        return reply.sessionId();
    }

    private RemoteReply post(URI uri, String token, String sessionId, Map<String, Object> message,
                             Object requestId, ToolCallContext context) {
        try {
            return restTemplate.execute(uri, HttpMethod.POST,
                request -> {
                    HttpHeaders headers = request.getHeaders();
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM));
                    if (token != null) {
                        headers.setBearerAuth(token);
                    }
                    if (sessionId != null) {
                        headers.set(McpHeaders.SESSION_ID, sessionId);
                    }
                    objectMapper.writeValue(request.getBody(), message);
                },
                response -> readReply(response, sessionId, requestId, context));
        } catch (RestClientException e) {
            throw new RemoteToolException("Request to " + uri + " failed: " + e.getMessage(), e);
        }
    }

    private RemoteReply readReply(ClientHttpResponse response, String sessionId, Object requestId,
                                  ToolCallContext context) throws IOException {
        String returnedSession = response.getHeaders().getFirst(McpHeaders.SESSION_ID);
        String effectiveSession = returnedSession != null ? returnedSession : sessionId;
        if (requestId == null) {
            return new RemoteReply(effectiveSession, null);
        }
        MediaType contentType = response.getHeaders().getContentType();
        try (InputStream body = response.getBody()) {
            if (contentType != null && MediaType.TEXT_EVENT_STREAM.isCompatibleWith(contentType)) {
                JsonRpcMessage message = eventStreamReader.read(body, requestId, notification -> forward(notification, context));
                return new RemoteReply(effectiveSession, message);
            }
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                return new RemoteReply(effectiveSession, null);
            }
            return new RemoteReply(effectiveSession, JsonRpcMessage.fromNode(objectMapper, node));
        }
    }

    private void forward(JsonRpcMessage notification, ToolCallContext context) {
        if (context == null) {
            return;
        }
        switch (notification.method()) {
            case "notifications/progress" -> {
                if (context.progressToken() != null) {
                    Map<String, Object> params = new LinkedHashMap<>(notification.params());
                    params.put("progressToken", context.progressToken());
                    context.notify(notification.method(), params);
                }
            }
            case "notifications/message" -> context.notify(notification.method(), notification.params());
            default -> log.debug("Dropping remote notification {}", notification.method());
        }
    }

    private void closeSession(URI uri, String token, String sessionId) {
        if (sessionId == null) {
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.set(McpHeaders.SESSION_ID, sessionId);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        try {
            restTemplate.exchange(uri, HttpMethod.DELETE, new HttpEntity<>(headers), Void.class);
        } catch (RestClientException e) {
            log.debug("Failed to close remote session {} at {}: {}", sessionId, uri, e.getMessage());
        }
    }

    private String baseUrl(RemoteEndpoint endpoint) {
        return String.format(urlTemplate, endpoint.subdomain());
    }

    private record RemoteReply(String sessionId, JsonRpcMessage message) {
    }
}
