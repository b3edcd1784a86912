package io.hfmcp.gateway.protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one tool argument, rendered as a JSON-schema property by {@link #toJsonSchema()}.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.</p>
 */
public final class ParamSchema {

    /**
     * Value shapes a parameter can accept.
     */
    public enum Type {
        STRING("string"),
        NUMBER("number"),
        INTEGER("integer"),
        BOOLEAN("boolean"),
        ARRAY("array"),
        OBJECT("object"),
        FILE_DATA("object"),
        ANY(null);

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }
    }

    private final Type type;
    private final String description;
    private final boolean optional;
    private final boolean hasDefault;
    private final Object defaultValue;

    private ParamSchema(Type type, String description, boolean optional, boolean hasDefault, Object defaultValue) {
        this.type = type;
        this.description = description;
        this.optional = optional;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
    }

    public static ParamSchema of(Type type) {
        return new ParamSchema(type, null, false, false, null);
    }

    public static ParamSchema string(String description) {
        return of(Type.STRING).withDescription(description);
    }

    public static ParamSchema number(String description) {
        return of(Type.NUMBER).withDescription(description);
    }

    public static ParamSchema bool(String description) {
        return of(Type.BOOLEAN).withDescription(description);
    }

    public ParamSchema withDescription(String description) {
        return new ParamSchema(type, description, optional, hasDefault, defaultValue);
    }

    public ParamSchema asOptional() {
        return new ParamSchema(type, description, true, hasDefault, defaultValue);
    }

    /**
     * A parameter with a default is optional; the default is filled in when the argument is absent.
     */
    public ParamSchema withDefault(Object defaultValue) {
        return new ParamSchema(type, description, true, true, defaultValue);
    }

    public Type type() {
        return type;
    }

    public String description() {
        return description;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        if (type == Type.FILE_DATA) {
            schema.putAll(fileDataSchema());
        } else if (type.jsonType() != null) {
            schema.put("type", type.jsonType());
        }
        if (description != null) {
            schema.put("description", description);
        }
        if (hasDefault) {
            schema.put("default", defaultValue);
        }
        return schema;
    }

    private static Map<String, Object> fileDataSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("path", Map.of("type", "string"));
        properties.put("url", Map.of("type", "string"));
        properties.put("size", Map.of("type", List.of("number", "null")));
        properties.put("orig_name", Map.of("type", "string"));
        properties.put("mime_type", Map.of("type", List.of("string", "null")));
        properties.put("is_stream", Map.of("type", "boolean"));
        properties.put("meta", Map.of(
            "type", "object",
            "properties", Map.of("_type", Map.of("type", "string"))));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("path"));
        return schema;
    }
}
