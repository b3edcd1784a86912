package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.MutableClock;
import io.hfmcp.gateway.client.RemoteToolProvider;
import io.hfmcp.gateway.config.GatewayProperties;
import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.RemoteToolSpec;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.protocol.JsonRpcMessage;
import io.hfmcp.gateway.protocol.McpHeaders;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.protocol.NotificationSink;
import io.hfmcp.gateway.protocol.ToolDescriptor;
import io.hfmcp.gateway.protocol.ToolResults;
import io.hfmcp.gateway.selection.BouquetCatalog;
import io.hfmcp.gateway.selection.ImpliedToolRules;
import io.hfmcp.gateway.selection.StaticSettingsProvider;
import io.hfmcp.gateway.selection.ToolSelectionStrategy;
import io.hfmcp.gateway.server.AugmentationPolicy;
import io.hfmcp.gateway.server.LocalServerFactory;
import io.hfmcp.gateway.server.ServerRequest;
import io.hfmcp.gateway.server.tools.LocalTool;
import io.hfmcp.gateway.server.tools.LocalToolCatalog;
import io.hfmcp.gateway.server.tools.ToolIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProxyServerFactoryTest {

    private static final List<RemoteToolSpec> FLUX_TOOLS = List.of(
        new RemoteToolSpec("predict", "Generate", Map.of()),
        new RemoteToolSpec("Predict", "", Map.of()),
        new RemoteToolSpec("<lambda>", "", Map.of()));

    private RemoteEndpointConnector connector;
    private ProxyServerFactory factory;

    @BeforeEach
    void setUp() {
        List<LocalTool> tools = new ArrayList<>();
        tools.add(new StubTool(ToolIds.WHOAMI));
        ToolIds.ALL.forEach(id -> tools.add(new StubTool(id)));

        RemoteEndpoint flux = RemoteEndpoint.builder()
            .id("flux").name("evalstate/flux").subdomain("evalstate-flux").emoji("🎨").build();
        ToolSelectionStrategy strategy = new ToolSelectionStrategy(
            BouquetCatalog.withDefaults(null),
            ImpliedToolRules.none(),
            new StaticSettingsProvider(List.of(ToolIds.MODEL_SEARCH), List.of(flux)),
            null);
        LocalServerFactory localServerFactory =
            new LocalServerFactory(strategy, new LocalToolCatalog(tools), new GatewayProperties());

        connector = mock(RemoteEndpointConnector.class);
        when(connector.connect(anyList(), any())).thenAnswer(invocation -> {
            List<RemoteEndpoint> endpoints = invocation.getArgument(0);
            List<RemoteConnection> connections = new ArrayList<>();
            for (int i = 0; i < endpoints.size(); i++) {
                connections.add(RemoteConnection.success(endpoints.get(i), i + 1, FLUX_TOOLS));
            }
            return connections;
        });

        ProxyToolFactory proxyToolFactory = new ProxyToolFactory(mock(RemoteToolProvider.class), new JsonSchemaConverter(),
            GatewayContext.create(TransportType.STREAMABLE_HTTP, MutableClock.startingAt("2025-01-01T00:00:00Z")));
        factory = new ProxyServerFactory(localServerFactory, connector, proxyToolFactory, new ToolNameGenerator(),
            List.of(new CompanionToolHook("EvalState/Flux", "flux_usage", "How to use flux", "Use short prompts")));
    }

    @Test
    void addsRemoteToolsNextToLocalOnes() {
        McpServerInstance server = factory.create(ServerRequest.of(Map.of(), AugmentationPolicy.ALWAYS, null));

        assertThat(server.toolNames()).containsExactly(
            ToolIds.WHOAMI, ToolIds.MODEL_SEARCH, "gr1_predict", "gr1_predict_1", "flux_usage");
    }

    @Test
    void gradioNoneDisablesRemoteTools() {
        McpServerInstance server = factory.create(
            ServerRequest.of(Map.of(McpHeaders.GRADIO, "none"), AugmentationPolicy.ALWAYS, null));

        assertThat(server.toolNames()).containsExactly(ToolIds.WHOAMI, ToolIds.MODEL_SEARCH);
        verify(connector, never()).connect(anyList(), any());
    }

    @Test
    void bouquetOverrideOtherThanAllSkipsRemoteTools() {
        McpServerInstance server = factory.create(
            ServerRequest.of(Map.of(McpHeaders.BOUQUET, "docs"), AugmentationPolicy.ALWAYS, null));

        assertThat(server.toolNames()).containsExactly(ToolIds.WHOAMI, ToolIds.DOC_SEARCH, ToolIds.DOC_FETCH);
        verify(connector, never()).connect(anyList(), any());
    }

    @Test
    void bouquetAllStillAugmentsWithParameterEndpoints() {
        McpServerInstance server = factory.create(ServerRequest.of(
            Map.of(McpHeaders.BOUQUET, "all", McpHeaders.GRADIO, "owner/other"), AugmentationPolicy.ALWAYS, null));

        assertThat(server.toolNames()).contains("gr1_predict").doesNotContain("flux_usage");
        assertThat(server.toolNames()).containsAll(ToolIds.ALL);
    }

    @Test
    void neverPolicyBuildsLocalOnlyServer() {
        McpServerInstance server = factory.create(ServerRequest.of(Map.of(), AugmentationPolicy.NEVER, null));

        assertThat(server.toolNames()).doesNotContain("gr1_predict");
        verify(connector, never()).connect(anyList(), any());
    }

    @Test
    void remoteToolsCarryEndpointTitle() {
        McpServerInstance server = factory.create(ServerRequest.of(Map.of(), AugmentationPolicy.ALWAYS, null));

        Map<String, Object> list = server.handle(
            new JsonRpcMessage(1L, "tools/list", null, null, null),
            NotificationSink.DISCARD).orElseThrow();
        assertThat(list.toString()).contains("evalstate/flux - predict 🎨").contains("Generate (from evalstate/flux)");
    }

    @Test
    void dedupesEndpointsBySubdomain() {
        RemoteEndpoint first = RemoteEndpoint.builder().id("a").name("owner/space").subdomain("owner-space").build();
        RemoteEndpoint second = RemoteEndpoint.builder().id("b").name("owner.space").subdomain("owner-space").build();
        RemoteEndpoint other = RemoteEndpoint.builder().id("c").name("owner/x").subdomain("owner-x").build();

        assertThat(ProxyServerFactory.dedupeBySubdomain(List.of(first, second, other))).containsExactly(first, other);
    }

    private record StubTool(String id) implements LocalTool {

        @Override
        public ToolDescriptor descriptor(String token) {
            return ToolDescriptor.builder().name(id).handler((args, context) -> ToolResults.text(id)).build();
        }
    }
}
