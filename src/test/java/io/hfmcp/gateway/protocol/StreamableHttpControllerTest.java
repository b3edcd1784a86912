package io.hfmcp.gateway.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.MutableClock;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.transport.StreamableHttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StreamableHttpControllerTest {

    private static final String INITIALIZE = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
        + "\"params\":{\"clientInfo\":{\"name\":\"inspector\",\"version\":\"0.9\"}}}";

    private StreamableHttpTransport transport;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GatewayContext context = GatewayContext.create(TransportType.STREAMABLE_HTTP,
            MutableClock.startingAt("2025-01-01T00:00:00Z"));
        transport = new StreamableHttpTransport(
            request -> McpServerInstance.builder().clientInfoListener(request.clientInfoListener()).build(),
            context, new ObjectMapper(), mock(TaskScheduler.class), new GatewayProperties.SessionConfig());
        mockMvc = MockMvcBuilders.standaloneSetup(new StreamableHttpController(transport))
            .setControllerAdvice(new TransportExceptionHandler())
            .build();
    }

    @Test
    void sessionLifecycleOverHttp() throws Exception {
        MvcResult initialized = mockMvc.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON).content(INITIALIZE))
            .andExpect(status().isOk())
            .andExpect(header().exists(McpHeaders.SESSION_ID))
            .andReturn();
        String sessionId = initialized.getResponse().getHeader(McpHeaders.SESSION_ID);
        assertThat(transport.getActiveConnectionCount()).isEqualTo(1);

        mockMvc.perform(post("/mcp")
                .header(McpHeaders.SESSION_ID, sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(2));

        mockMvc.perform(delete("/mcp").header(McpHeaders.SESSION_ID, sessionId))
            .andExpect(status().isOk());
        assertThat(transport.getActiveConnectionCount()).isZero();

        mockMvc.perform(post("/mcp")
                .header(McpHeaders.SESSION_ID, sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"ping\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value(JsonRpcErrors.SESSION_NOT_FOUND));
    }

    @Test
    void requestWithoutSessionMustBeInitialize() throws Exception {
        mockMvc.perform(post("/mcp")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("Bad Request: No valid session ID provided"));
    }

    @Test
    void streamForUnknownSessionIsRejectedAsJson() throws Exception {
        mockMvc.perform(get("/mcp").header(McpHeaders.SESSION_ID, "missing"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value(JsonRpcErrors.SESSION_NOT_FOUND));
    }
}
