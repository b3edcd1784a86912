package io.hfmcp.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the MCP gateway.
 */
@ConfigurationProperties(prefix = "mcp.gateway")
public class GatewayProperties {

    private String transport = "streamable-http";
    private boolean strictCompliance = false;
    private String defaultToken;
    private String hubUrl = "https://huggingface.co";
    private String serverName = "hf-mcp-gateway";
    private String serverVersion = "0.1.0";
    private SessionConfig session = new SessionConfig();
    private RemoteConfig remote = new RemoteConfig();
    private SettingsConfig settings = new SettingsConfig();
    private ToolsConfig tools = new ToolsConfig();
    private Map<String, List<String>> bouquets = new LinkedHashMap<>();
    private List<CompanionToolConfig> companionTools = new ArrayList<>();
    private CacheConfig cache = new CacheConfig();

    // Getters and setters
    public String getTransport() { return transport; }
    public void setTransport(String transport) { this.transport = transport; }

    public boolean isStrictCompliance() { return strictCompliance; }
    public void setStrictCompliance(boolean strictCompliance) { this.strictCompliance = strictCompliance; }

    public String getDefaultToken() { return defaultToken; }
    public void setDefaultToken(String defaultToken) { this.defaultToken = defaultToken; }

    public String getHubUrl() { return hubUrl; }
    public void setHubUrl(String hubUrl) { this.hubUrl = hubUrl; }

    public String getServerName() { return serverName; }
    public void setServerName(String serverName) { this.serverName = serverName; }

    public String getServerVersion() { return serverVersion; }
    public void setServerVersion(String serverVersion) { this.serverVersion = serverVersion; }

    public SessionConfig getSession() { return session; }
    public void setSession(SessionConfig session) { this.session = session; }

    public RemoteConfig getRemote() { return remote; }
    public void setRemote(RemoteConfig remote) { this.remote = remote; }

    public SettingsConfig getSettings() { return settings; }
    public void setSettings(SettingsConfig settings) { this.settings = settings; }

    public ToolsConfig getTools() { return tools; }
    public void setTools(ToolsConfig tools) { this.tools = tools; }

    public Map<String, List<String>> getBouquets() { return bouquets; }
    public void setBouquets(Map<String, List<String>> bouquets) { this.bouquets = bouquets; }

    public List<CompanionToolConfig> getCompanionTools() { return companionTools; }
    public void setCompanionTools(List<CompanionToolConfig> companionTools) { this.companionTools = companionTools; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    /**
     * Session lifecycle timings for the stateful transports.
     */
    public static class SessionConfig {
        private Duration checkInterval = Duration.ofSeconds(30);
        private Duration staleTimeout = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }

        public Duration getStaleTimeout() { return staleTimeout; }
        public void setStaleTimeout(Duration staleTimeout) { this.staleTimeout = staleTimeout; }

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    }

    /**
     * Remote (Gradio) endpoint connection settings.
     */
    public static class RemoteConfig {
        private String urlTemplate = "https://%s.hf.space";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofMillis(12500);
        private Duration callTimeout = Duration.ofMinutes(5);
        private Duration connectionTimeout = Duration.ofSeconds(12);
        private int maxNameLength = 49;
        private int nameHeadLength = 20;
        private int connectorThreads = 16;

        public String getUrlTemplate() { return urlTemplate; }
        public void setUrlTemplate(String urlTemplate) { this.urlTemplate = urlTemplate; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }

        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }

        public int getMaxNameLength() { return maxNameLength; }
        public void setMaxNameLength(int maxNameLength) { this.maxNameLength = maxNameLength; }

        public int getNameHeadLength() { return nameHeadLength; }
        public void setNameHeadLength(int nameHeadLength) { this.nameHeadLength = nameHeadLength; }

        public int getConnectorThreads() { return connectorThreads; }
        public void setConnectorThreads(int connectorThreads) { this.connectorThreads = connectorThreads; }
    }

    /**
     * Where per-user tool settings come from.
     */
    public static class SettingsConfig {
        private String mode = "static";
        private String externalUrl;
        private Duration timeout = Duration.ofMillis(12500);
        private List<String> enabledToolIds;
        private List<EndpointConfig> endpoints = new ArrayList<>();

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getExternalUrl() { return externalUrl; }
        public void setExternalUrl(String externalUrl) { this.externalUrl = externalUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public List<String> getEnabledToolIds() { return enabledToolIds; }
        public void setEnabledToolIds(List<String> enabledToolIds) { this.enabledToolIds = enabledToolIds; }

        public List<EndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }
    }

    /**
     * A statically configured remote endpoint.
     */
    public static class EndpointConfig {
        private String id;
        private String name;
        private String subdomain;
        private String emoji;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getSubdomain() { return subdomain; }
        public void setSubdomain(String subdomain) { this.subdomain = subdomain; }

        public String getEmoji() { return emoji; }
        public void setEmoji(String emoji) { this.emoji = emoji; }
    }

    /**
     * Local tool flags.
     */
    public static class ToolsConfig {
        private boolean searchEnablesFetch = false;

        public boolean isSearchEnablesFetch() { return searchEnablesFetch; }
        public void setSearchEnablesFetch(boolean searchEnablesFetch) { this.searchEnablesFetch = searchEnablesFetch; }
    }

    /**
     * A static text tool registered after the tools of a named endpoint.
     */
    public static class CompanionToolConfig {
        private String endpoint;
        private String toolName;
        private String description;
        private String text;

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getToolName() { return toolName; }
        public void setToolName(String toolName) { this.toolName = toolName; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    /**
     * Cache configuration.
     */
    public static class CacheConfig {
        private Duration visibilityTtl = Duration.ofMinutes(10);
        private int maxSize = 10000;

        public Duration getVisibilityTtl() { return visibilityTtl; }
        public void setVisibilityTtl(Duration visibilityTtl) { this.visibilityTtl = visibilityTtl; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }
}
