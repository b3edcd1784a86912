package io.hfmcp.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.selection.BouquetCatalog;
import io.hfmcp.gateway.selection.GradioEndpointParser;
import io.hfmcp.gateway.selection.HttpSettingsProvider;
import io.hfmcp.gateway.selection.ImpliedToolRules;
import io.hfmcp.gateway.selection.SettingsProvider;
import io.hfmcp.gateway.selection.StaticSettingsProvider;
import io.hfmcp.gateway.selection.ToolSelectionStrategy;
import io.hfmcp.gateway.server.tools.ToolIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;

/**
 * Tool selection: bouquets, implied tools and where user settings come from.
 */
@Configuration
public class SelectionConfig {

    private static final Logger log = LoggerFactory.getLogger(SelectionConfig.class);

    @Bean
    public BouquetCatalog bouquetCatalog(GatewayProperties properties) {
        BouquetCatalog catalog = BouquetCatalog.withDefaults(properties.getBouquets());
        log.info("Loaded bouquets: {}", catalog.bouquets().keySet());
        return catalog;
    }

    @Bean
    public ImpliedToolRules impliedToolRules(GatewayProperties properties) {
        return new ImpliedToolRules(List.of(
            new ImpliedToolRules.Rule(ToolIds.DOC_SEARCH, ToolIds.DOC_FETCH, properties.getTools().isSearchEnablesFetch())));
    }

    @Bean
    public SettingsProvider settingsProvider(GatewayProperties properties,
                                             RestTemplateBuilder restTemplateBuilder,
                                             ObjectMapper objectMapper) {
        GatewayProperties.SettingsConfig settings = properties.getSettings();
        String mode = settings.getMode() == null ? "static" : settings.getMode().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "static" -> {
                List<RemoteEndpoint> endpoints = settings.getEndpoints().stream()
                    .map(SelectionConfig::toEndpoint)
                    .toList();
                log.info("Using static settings ({} tool ids, {} endpoints)",
                    settings.getEnabledToolIds() == null ? "no" : settings.getEnabledToolIds().size(), endpoints.size());
                return new StaticSettingsProvider(settings.getEnabledToolIds(), endpoints);
            }
            case "external" -> {
                if (settings.getExternalUrl() == null || settings.getExternalUrl().isBlank()) {
                    throw new IllegalStateException("mcp.gateway.settings.external-url is required in external mode");
                }
                log.info("Using external settings from {} (timeout {})", settings.getExternalUrl(), settings.getTimeout());
                return new HttpSettingsProvider(
                    restTemplateBuilder
                        .setConnectTimeout(settings.getTimeout())
                        .setReadTimeout(settings.getTimeout())
                        .build(),
                    objectMapper,
                    settings.getExternalUrl());
            }
            default -> throw new IllegalStateException("Unsupported settings mode: " + settings.getMode());
        }
    }

    @Bean
    public ToolSelectionStrategy toolSelectionStrategy(BouquetCatalog bouquetCatalog,
                                                       ImpliedToolRules impliedToolRules,
                                                       SettingsProvider settingsProvider,
                                                       GatewayProperties properties) {
        return new ToolSelectionStrategy(bouquetCatalog, impliedToolRules, settingsProvider, properties.getDefaultToken());
    }

    private static RemoteEndpoint toEndpoint(GatewayProperties.EndpointConfig config) {
        String subdomain = config.getSubdomain();
        if (subdomain == null && config.getName() != null) {
            subdomain = GradioEndpointParser.subdomainOf(config.getName());
        }
        return RemoteEndpoint.builder()
            .id(config.getId() != null ? config.getId() : "gradio_" + subdomain)
            .name(config.getName())
            .subdomain(subdomain)
            .emoji(config.getEmoji())
            .build();
    }
}
