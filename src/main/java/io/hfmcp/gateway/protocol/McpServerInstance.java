package io.hfmcp.gateway.protocol;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.model.ClientInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MCP protocol server bound to one session (or one request for the stateless transport).
 *
 * <p>Tools are registered through the {@link Builder}; once built the tool registry is read-only.
 * The instance answers the MCP lifecycle, tool and listing methods and reports tool handler
 * failures to the caller as error results.</p>
 */
public class McpServerInstance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(McpServerInstance.class);

    public static final String LATEST_PROTOCOL_VERSION = "2025-06-18";
    public static final List<String> SUPPORTED_PROTOCOL_VERSIONS =
        List.of(LATEST_PROTOCOL_VERSION, "2025-03-26", "2024-11-05");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String version;
    private final String instructions;
    private final Map<String, ToolDescriptor> tools;
    private final ClientInfoListener clientInfoListener;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ClientInfo clientInfo;
    private volatile boolean initialized;

    private McpServerInstance(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.instructions = builder.instructions;
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tools));
        this.clientInfoListener = builder.clientInfoListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handle one inbound message.
     *
     * @param message the parsed message
     * @param notifications channel for notifications emitted while handling the message
     * @return the response for requests, empty for notifications and responses
     * @throws IllegalStateException if the instance has been closed
     */
    public Optional<Map<String, Object>> handle(JsonRpcMessage message, NotificationSink notifications) {
        if (closed.get()) {
            throw new IllegalStateException("Server instance is closed");
        }
        if (message.isResponse()) {
            log.debug("Ignoring client response for id {}", message.id());
            return Optional.empty();
        }
        if (message.isNotification()) {
            handleNotification(message);
            return Optional.empty();
        }
        try {
            Object result = dispatch(message, notifications);
            return Optional.of(JsonRpcMessage.response(message.id(), result));
        } catch (McpProtocolException e) {
            log.debug("Request {} ({}) failed: {}", message.id(), message.method(), e.getMessage());
            return Optional.of(JsonRpcErrors.error(message.id(), e.getCode(), e.getMessage()));
        }
    }

    private Object dispatch(JsonRpcMessage message, NotificationSink notifications) {
        Map<String, Object> params = message.params();
        return switch (message.method()) {
            case "initialize" -> initialize(params);
            case "ping" -> Map.of();
            case "tools/list" -> Map.of("tools", tools.values().stream().map(ToolDescriptor::toListEntry).toList());
            case "tools/call" -> callTool(message.id(), params, notifications);
            case "prompts/list" -> Map.of("prompts", List.of());
            case "prompts/get" -> throw new InvalidParamsException("Prompt not found: " + params.get("name"));
            case "resources/list" -> Map.of("resources", List.of());
            case "resources/templates/list" -> Map.of("resourceTemplates", List.of());
            default -> throw new McpProtocolException(JsonRpcErrors.METHOD_NOT_FOUND, "Method not found: " + message.method());
        };
    }

    private void handleNotification(JsonRpcMessage message) {
        switch (message.method()) {
            case "notifications/initialized" -> {
                initialized = true;
                log.debug("Client {} completed initialization", clientInfo);
            }
            case "notifications/cancelled" -> log.debug("Client cancelled request {}", message.params().get("requestId"));
            default -> log.debug("Ignoring notification {}", message.method());
        }
    }

    private Map<String, Object> initialize(Map<String, Object> params) {
        Object requested = params.get("protocolVersion");
        String protocolVersion = requested instanceof String v && SUPPORTED_PROTOCOL_VERSIONS.contains(v)
            ? v : LATEST_PROTOCOL_VERSION;

        Map<String, Object> info = asObject(params.get("clientInfo"));
        Map<String, Object> capabilities = asObject(params.get("capabilities"));
        if (info.get("name") instanceof String clientName) {
            Object clientVersion = info.get("version");
            clientInfo = new ClientInfo(clientName, clientVersion == null ? "" : String.valueOf(clientVersion));
            clientInfoListener.onInitialized(clientInfo,
                capabilities.containsKey("sampling"), capabilities.containsKey("roots"));
        }

        Map<String, Object> serverCapabilities = new LinkedHashMap<>();
        serverCapabilities.put("tools", Map.of("listChanged", false));
        serverCapabilities.put("prompts", Map.of("listChanged", false));
        serverCapabilities.put("resources", Map.of("listChanged", false));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", protocolVersion);
        result.put("capabilities", serverCapabilities);
        result.put("serverInfo", Map.of("name", name, "version", version));
        if (instructions != null) {
            result.put("instructions", instructions);
        }
        return result;
    }

    private Map<String, Object> callTool(Object requestId, Map<String, Object> params, NotificationSink notifications) {
        if (!(params.get("name") instanceof String toolName)) {
            throw new InvalidParamsException("Invalid params: tool name is required");
        }
        ToolDescriptor tool = tools.get(toolName);
        if (tool == null) {
            throw new InvalidParamsException("Unknown tool: " + toolName);
        }
        Object rawArguments = params.get("arguments");
        if (rawArguments != null && !(rawArguments instanceof Map)) {
            throw new InvalidParamsException("Invalid params: arguments must be an object");
        }
        Map<String, Object> arguments = tool.inputSchema().validate(rawArguments == null ? null : asObject(rawArguments));

        Object progressToken = params.get("_meta") instanceof Map<?, ?> meta ? meta.get("progressToken") : null;
        ToolCallContext context = new ToolCallContext(requestId, progressToken, notifications);
        try {
            Map<String, Object> result = tool.handler().handle(arguments, context);
            return result != null ? result : ToolResults.text("");
        } catch (McpProtocolException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResults.error("Tool call interrupted");
        } catch (Exception e) {
            log.warn("Tool {} failed: {}", toolName, e.getMessage());
            return ToolResults.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static Map<String, Object> asObject(Object value) {
        return value instanceof Map<?, ?> map ? MAPPER.convertValue(map, OBJECT_TYPE) : Map.of();
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    public Optional<ClientInfo> clientInfo() {
        return Optional.ofNullable(clientInfo);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closed server instance with {} tools", tools.size());
        }
    }

    /**
     * Collects tools and server info. A builder builds exactly once.
     */
    public static class Builder {
        private String name = "hf-mcp-gateway";
        private String version = "0.0.0";
        private String instructions;
        private ClientInfoListener clientInfoListener = ClientInfoListener.NONE;
        private final Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        private boolean built;

        public Builder serverInfo(String name, String version) {
            this.name = name;
            this.version = version;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder clientInfoListener(ClientInfoListener clientInfoListener) {
            this.clientInfoListener = clientInfoListener != null ? clientInfoListener : ClientInfoListener.NONE;
            return this;
        }

        /**
         * Register a tool.
         *
         * @throws IllegalStateException if a tool with the same name is already registered or
         *         the server has already been built
         */
        public Builder tool(ToolDescriptor tool) {
            if (built) {
                throw new IllegalStateException("Server already built; tool registry is sealed");
            }
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
            return this;
        }

        public boolean hasTool(String name) {
            return tools.containsKey(name);
        }

        public List<String> toolNames() {
            return new ArrayList<>(tools.keySet());
        }

        public McpServerInstance build() {
            if (built) {
                throw new IllegalStateException("Server already built");
            }
            built = true;
            return new McpServerInstance(this);
        }
    }
}
