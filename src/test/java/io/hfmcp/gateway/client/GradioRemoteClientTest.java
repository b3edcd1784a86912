package io.hfmcp.gateway.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.protocol.McpHeaders;
import io.hfmcp.gateway.protocol.ToolCallContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GradioRemoteClientTest {

    private static final String BASE = "https://evalstate-flux.hf.space";
    private static final RemoteEndpoint FLUX = RemoteEndpoint.builder()
        .id("flux").name("evalstate/flux").subdomain("evalstate-flux").build();

    private MockRestServiceServer server;
    private GradioRemoteClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GradioRemoteClient(restTemplate, restTemplate, new ObjectMapper(), new GatewayProperties());
    }

    @Test
    void fetchesSchemaWithToken() {
        server.expect(requestTo(BASE + GradioRemoteClient.SCHEMA_PATH))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer hf_secret"))
            .andRespond(withSuccess("{\"predict\": {\"properties\": {}}}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchSchema(FLUX, "hf_secret").has("predict")).isTrue();
        server.verify();
    }

    @Test
    void schemaServerErrorBecomesRemoteToolException() {
        server.expect(requestTo(BASE + GradioRemoteClient.SCHEMA_PATH)).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchSchema(FLUX, null))
            .isInstanceOf(RemoteToolException.class)
            .hasMessageContaining("evalstate/flux");
    }

    @Test
    void toolCallRunsSessionAndForwardsNotifications() {
        String mcpUrl = BASE + GradioRemoteClient.MCP_PATH;
        HttpHeaders sessionHeaders = new HttpHeaders();
        sessionHeaders.set(McpHeaders.SESSION_ID, "remote-1");

        server.expect(requestTo(mcpUrl))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.method").value("initialize"))
            .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"protocolVersion\":\"2025-06-18\"}}",
                MediaType.APPLICATION_JSON).headers(sessionHeaders));
        server.expect(requestTo(mcpUrl))
            .andExpect(jsonPath("$.method").value("notifications/initialized"))
            .andExpect(header(McpHeaders.SESSION_ID, "remote-1"))
            .andRespond(withStatus(HttpStatus.ACCEPTED));
        server.expect(requestTo(mcpUrl))
            .andExpect(jsonPath("$.method").value("tools/call"))
            .andExpect(jsonPath("$.params.name").value("predict"))
            .andExpect(jsonPath("$.params.arguments.prompt").value("a cat"))
            .andRespond(withSuccess(
                "event: message\n"
                    + "data: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\",\"params\":{\"level\":\"info\",\"data\":\"working\"}}\n"
                    + "\n"
                    + "event: message\n"
                    + "data: {\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"done\"}]}}\n"
                    + "\n",
                MediaType.TEXT_EVENT_STREAM));
        server.expect(requestTo(mcpUrl))
            .andExpect(method(HttpMethod.DELETE))
            .andExpect(header(McpHeaders.SESSION_ID, "remote-1"))
            .andRespond(withSuccess());

        List<Map<String, Object>> notifications = new ArrayList<>();
        Map<String, Object> result = client.callTool(FLUX, "predict", Map.of("prompt", "a cat"), null,
            new ToolCallContext(7, null, notifications::add));

        server.verify();
        assertThat(result.get("content")).asList().hasSize(1);
        assertThat(notifications).singleElement()
            .satisfies(notification -> assertThat(notification).containsEntry("method", "notifications/message"));
    }

    @Test
    void remoteErrorResponseIsRaised() {
        String mcpUrl = BASE + GradioRemoteClient.MCP_PATH;
        HttpHeaders sessionHeaders = new HttpHeaders();
        sessionHeaders.set(McpHeaders.SESSION_ID, "remote-2");

        server.expect(requestTo(mcpUrl))
            .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}", MediaType.APPLICATION_JSON)
                .headers(sessionHeaders));
        server.expect(requestTo(mcpUrl)).andRespond(withStatus(HttpStatus.ACCEPTED));
        server.expect(requestTo(mcpUrl))
            .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":2,\"error\":{\"code\":-32602,\"message\":\"bad prompt\"}}",
                MediaType.APPLICATION_JSON));
        server.expect(requestTo(mcpUrl)).andExpect(method(HttpMethod.DELETE)).andRespond(withSuccess());

        assertThatThrownBy(() -> client.callTool(FLUX, "predict", Map.of(), null, new ToolCallContext(1, null, null)))
            .isInstanceOf(RemoteToolException.class)
            .hasMessageContaining("bad prompt");
        server.verify();
    }
}
