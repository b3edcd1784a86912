package io.hfmcp.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.GatewayContext;
import io.hfmcp.gateway.model.TransportType;
import io.hfmcp.gateway.proxy.CompanionToolHook;
import io.hfmcp.gateway.proxy.PostRegistrationHook;
import io.hfmcp.gateway.proxy.ToolNameGenerator;
import io.hfmcp.gateway.server.ServerFactory;
import io.hfmcp.gateway.transport.McpTransport;
import io.hfmcp.gateway.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Wires the gateway context, proxy naming and the configured transport.
 */
@Configuration
public class TransportConfig {

    private static final Logger log = LoggerFactory.getLogger(TransportConfig.class);

    /**
     * Fails startup for an unsupported transport name.
     */
    @Bean
    public GatewayContext gatewayContext(GatewayProperties properties) {
        TransportType type = TransportType.fromValue(properties.getTransport());
        log.info("Starting gateway with {} transport", type.value());
        return GatewayContext.create(type, Clock.systemUTC());
    }

    @Bean
    public ToolNameGenerator toolNameGenerator(GatewayProperties properties) {
        return new ToolNameGenerator(properties.getRemote().getMaxNameLength(), properties.getRemote().getNameHeadLength());
    }

    @Bean
    public List<PostRegistrationHook> postRegistrationHooks(GatewayProperties properties) {
        List<PostRegistrationHook> hooks = properties.getCompanionTools().stream()
            .<PostRegistrationHook>map(config -> new CompanionToolHook(
                config.getEndpoint(), config.getToolName(), config.getDescription(), config.getText()))
            .toList();
        if (!hooks.isEmpty()) {
            log.info("Registered {} companion tool hooks", hooks.size());
        }
        return hooks;
    }

    @Bean
    public TransportFactory transportFactory(ServerFactory serverFactory,
                                             GatewayContext gatewayContext,
                                             ObjectMapper objectMapper,
                                             @Qualifier("transportScheduler") TaskScheduler transportScheduler,
                                             GatewayProperties properties) {
        return new TransportFactory(serverFactory, gatewayContext, objectMapper, transportScheduler, properties);
    }

    @Bean
    public McpTransport mcpTransport(TransportFactory transportFactory, GatewayContext gatewayContext) {
        return transportFactory.create(gatewayContext.transportType());
    }
}
