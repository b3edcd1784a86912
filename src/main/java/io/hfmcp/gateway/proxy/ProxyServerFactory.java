package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.model.RemoteConnection;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.RemoteToolSpec;
import io.hfmcp.gateway.protocol.McpServerInstance;
import io.hfmcp.gateway.server.AugmentationPolicy;
import io.hfmcp.gateway.server.LocalServerFactory;
import io.hfmcp.gateway.server.ServerFactory;
import io.hfmcp.gateway.server.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Server factory that adds proxied remote tools on top of the local ones.
 *
 * <p>Candidate endpoints are deduplicated by subdomain, discovered through the
 * {@link RemoteEndpointConnector}, and every tool of every successful connection is registered
 * under a generated name. Failed endpoints contribute no tools and never fail the request.</p>
 */
@Service
public class ProxyServerFactory implements ServerFactory {

    private static final Logger log = LoggerFactory.getLogger(ProxyServerFactory.class);

    private static final String LAMBDA_MARKER = "<lambda>";

    private final LocalServerFactory localServerFactory;
    private final RemoteEndpointConnector connector;
    private final ProxyToolFactory proxyToolFactory;
    private final ToolNameGenerator nameGenerator;
    private final Map<String, List<PostRegistrationHook>> hooks = new LinkedHashMap<>();

    public ProxyServerFactory(LocalServerFactory localServerFactory,
                              RemoteEndpointConnector connector,
                              ProxyToolFactory proxyToolFactory,
                              ToolNameGenerator nameGenerator,
                              List<PostRegistrationHook> hooks) {
        this.localServerFactory = localServerFactory;
        this.connector = connector;
        this.proxyToolFactory = proxyToolFactory;
        this.nameGenerator = nameGenerator;
        for (PostRegistrationHook hook : hooks) {
            this.hooks.computeIfAbsent(hook.endpointName().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(hook);
        }
    }

    @Override
    public McpServerInstance create(ServerRequest request) {
        LocalServerFactory.Composition composition = localServerFactory.compose(request);
        McpServerInstance.Builder builder = composition.builder();

        AugmentationPolicy policy = AugmentationPolicy.resolve(
            request.augmentation(), composition.context(), composition.selection());
        if (!policy.augments()) {
            log.debug("Skipping remote tools: {}", policy);
            return builder.build();
        }

        List<RemoteEndpoint> endpoints = dedupeBySubdomain(composition.selection().remoteEndpoints());
        if (endpoints.isEmpty()) {
            return builder.build();
        }

        List<RemoteConnection> connections = connector.connect(endpoints, composition.context().token());
        for (RemoteConnection connection : connections) {
            if (!connection.success()) {
                log.debug("Remote endpoint {} unavailable: {}", connection.endpoint().name(), connection.error());
                continue;
            }
            List<String> registered = registerTools(builder, connection, composition.context().token());
            runHooks(builder, connection, registered);
        }
        return builder.build();
    }

    private List<String> registerTools(McpServerInstance.Builder builder, RemoteConnection connection, String token) {
        RemoteEndpoint endpoint = connection.endpoint();
        List<String> registered = new ArrayList<>();
        List<RemoteToolSpec> tools = connection.tools();
        for (int toolIndex = 0; toolIndex < tools.size(); toolIndex++) {
            RemoteToolSpec spec = tools.get(toolIndex);
            if (spec.name().contains(LAMBDA_MARKER)) {
                log.debug("Skipping lambda tool {} from {}", spec.name(), endpoint.name());
                continue;
            }
            String name = nameGenerator.generate(spec.name(), connection.ordinal(), endpoint.visibility(), toolIndex);
            if (builder.hasTool(name)) {
                name = nameGenerator.generateDisambiguated(spec.name(), connection.ordinal(), endpoint.visibility(), toolIndex);
            }
            if (builder.hasTool(name)) {
                log.error("Cannot register remote tool {} from {}: name {} already taken", spec.name(), endpoint.name(), name);
                continue;
            }
            builder.tool(proxyToolFactory.create(name, endpoint, spec, token));
            registered.add(name);
        }
        log.debug("Registered {} tools from {}", registered.size(), endpoint.name());
        return registered;
    }

    private void runHooks(McpServerInstance.Builder builder, RemoteConnection connection, List<String> registered) {
        String name = connection.endpoint().name();
        if (name == null) {
            return;
        }
        for (PostRegistrationHook hook : hooks.getOrDefault(name.toLowerCase(Locale.ROOT), List.of())) {
            hook.afterRegistration(builder, connection, registered);
        }
    }

    static List<RemoteEndpoint> dedupeBySubdomain(List<RemoteEndpoint> endpoints) {
        Set<String> seen = new HashSet<>();
        List<RemoteEndpoint> unique = new ArrayList<>();
        for (RemoteEndpoint endpoint : endpoints) {
            if (!endpoint.hasAddress() || seen.add(endpoint.subdomain())) {
                unique.add(endpoint);
            }
        }
        return unique;
    }
}
