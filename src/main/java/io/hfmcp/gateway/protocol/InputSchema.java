package io.hfmcp.gateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Object-shaped argument validator for a tool.
 *
 * <p>Arguments are checked against the schema returned by {@link #toJsonSchema()}. Arguments not
 * declared as properties are dropped before the handler sees them, and a {@code null} for an
 * optional property counts as absent.</p>
 */
public final class InputSchema {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final InputSchema EMPTY = new InputSchema(Map.of());

    private final Map<String, ParamSchema> properties;
    private final JsonSchema jsonSchema;

    private InputSchema(Map<String, ParamSchema> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.jsonSchema = SCHEMA_FACTORY.getSchema(MAPPER.<JsonNode>valueToTree(toJsonSchema()));
    }

    public static InputSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ParamSchema> properties() {
        return properties;
    }

    /**
     * Validate call arguments and fill in defaults.
     *
     * @param arguments the raw arguments, may be {@code null}
     * @return the validated arguments
     * @throws InvalidParamsException when the declared arguments do not match the schema
     */
    public Map<String, Object> validate(Map<String, Object> arguments) {
        Map<String, Object> supplied = arguments == null ? Map.of() : arguments;
        Map<String, Object> declared = new LinkedHashMap<>();
        for (Map.Entry<String, ParamSchema> entry : properties.entrySet()) {
            String field = entry.getKey();
            Object value = supplied.get(field);
            if (value != null) {
                declared.put(field, value);
            } else if (supplied.containsKey(field) && isRequired(entry.getValue())) {
                throw new InvalidParamsException("Invalid arguments: '" + field + "' must not be null");
            }
        }

        Set<ValidationMessage> errors = jsonSchema.validate(MAPPER.<JsonNode>valueToTree(declared));
        if (!errors.isEmpty()) {
            throw new InvalidParamsException("Invalid arguments: " + errors.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.joining("; ")));
        }

        Map<String, Object> validated = new LinkedHashMap<>();
        properties.forEach((field, param) -> {
            if (declared.containsKey(field)) {
                validated.put(field, declared.get(field));
            } else if (param.hasDefault()) {
                validated.put(field, param.defaultValue());
            }
        });
        return validated;
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        properties.forEach((name, param) -> {
            props.put(name, param.toJsonSchema());
            if (isRequired(param)) {
                required.add(name);
            }
        });
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    private static boolean isRequired(ParamSchema param) {
        return !param.isOptional() && param.type() != ParamSchema.Type.ANY;
    }

    public static class Builder {
        private final Map<String, ParamSchema> properties = new LinkedHashMap<>();

        public Builder property(String name, ParamSchema schema) {
            properties.put(name, schema);
            return this;
        }

        public InputSchema build() {
            return properties.isEmpty() ? EMPTY : new InputSchema(properties);
        }
    }
}
