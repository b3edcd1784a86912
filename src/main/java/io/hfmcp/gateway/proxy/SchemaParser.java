package io.hfmcp.gateway.proxy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.model.RemoteToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a remote schema document into tool specs.
 *
 * <p>Two shapes are accepted and yield the same specs for the same tools:</p>
 * <ul>
 *   <li>an array of {@code {name, description, inputSchema}}; entries without a string name or
 *       without an input schema are skipped</li>
 *   <li>an object keyed by tool name whose values are the input schemas, carrying the
 *       description inline</li>
 * </ul>
 */
@Component
public class SchemaParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SchemaParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param schema the schema document
     * @param endpointId endpoint id for log context
     * @return at least one tool spec
     * @throws SchemaParseException for an unsupported shape or when no tools are found
     */
    public List<RemoteToolSpec> parse(JsonNode schema, String endpointId) {
        List<RemoteToolSpec> tools = new ArrayList<>();
        if (schema != null && schema.isArray()) {
            for (JsonNode entry : schema) {
                if (entry.isObject() && entry.path("name").isTextual() && entry.has("inputSchema")) {
                    tools.add(toSpec(entry.get("name").asText(), entry.path("description"), entry.get("inputSchema")));
                }
            }
            log.debug("Endpoint {} schema (array format): {} tools", endpointId, tools.size());
        } else if (schema != null && schema.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = schema.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode toolSchema = field.getValue();
                tools.add(toSpec(field.getKey(), toolSchema.path("description"), toolSchema));
            }
            log.debug("Endpoint {} schema (object format): {} tools", endpointId, tools.size());
        } else {
            throw new SchemaParseException(SchemaParseException.INVALID_FORMAT);
        }
        if (tools.isEmpty()) {
            throw new SchemaParseException(SchemaParseException.NO_TOOLS);
        }
        return tools;
    }

    private RemoteToolSpec toSpec(String name, JsonNode description, JsonNode inputSchema) {
        return new RemoteToolSpec(name, description.isTextual() ? description.asText() : "", normalize(inputSchema));
    }

    private Map<String, Object> normalize(JsonNode inputSchema) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("type", "object");
        JsonNode properties = inputSchema.path("properties");
        normalized.put("properties", properties.isObject() ? objectMapper.convertValue(properties, MAP_TYPE) : Map.of());
        List<String> required = new ArrayList<>();
        inputSchema.path("required").forEach(node -> {
            if (node.isTextual()) {
                required.add(node.asText());
            }
        });
        normalized.put("required", required);
        return normalized;
    }
}
