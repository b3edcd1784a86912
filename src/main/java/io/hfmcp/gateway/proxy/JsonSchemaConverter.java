package io.hfmcp.gateway.proxy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Converts remote JSON-schema properties into argument validators. Total: unknown shapes become
 * unconstrained parameters rather than errors.
 */
@Component
public class JsonSchemaConverter {

    static final String FILE_URL_FORMAT = "a http or https url to a file";
    static final String FILE_DATA_TITLE = "FileData";
    static final String FILE_HINT = "File input: provide URL or file path";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PROPERTY_TYPE = new TypeReference<>() {
    };

    /**
     * Convert a normalised tool input schema. Fields absent from {@code required} are optional;
     * required fields never receive a default.
     */
    public InputSchema convertInputSchema(Map<String, Object> inputSchema) {
        InputSchema.Builder builder = InputSchema.builder();
        if (!(inputSchema.get("properties") instanceof Map<?, ?> properties)) {
            return builder.build();
        }
        List<?> required = inputSchema.get("required") instanceof List<?> list ? list : List.of();
        properties.forEach((key, value) -> {
            String name = String.valueOf(key);
            Map<String, Object> property = value instanceof Map<?, ?> map ? MAPPER.convertValue(map, PROPERTY_TYPE) : Map.<String, Object>of();
            boolean isRequired = required.contains(name);
            ParamSchema param = convertProperty(property, isRequired);
            builder.property(name, isRequired ? param : param.asOptional());
        });
        return builder.build();
    }

    /**
     * Convert one property.
     *
     * @param property the JSON-schema property
     * @param skipDefault do not apply the property's default
     * @return the validator
     */
    public ParamSchema convertProperty(Map<String, Object> property, boolean skipDefault) {
        Object title = property.get("title");
        Object format = property.get("format");
        Object type = property.get("type");
        boolean hasDefault = property.containsKey("default") && property.get("default") != null;
        Object defaultValue = property.get("default");

        boolean fileData = FILE_DATA_TITLE.equals(title)
            || (FILE_URL_FORMAT.equals(format) && defaultValue instanceof Map);
        ParamSchema param = ParamSchema.of(fileData ? ParamSchema.Type.FILE_DATA : typeOf(type));

        String description = property.get("description") instanceof String d ? d : "";
        if (FILE_URL_FORMAT.equals(format) || FILE_DATA_TITLE.equals(title)) {
            description = description.isEmpty() ? FILE_HINT : description + " (" + FILE_HINT + ")";
        }
        if (!description.isEmpty()) {
            param = param.withDescription(description);
        }

        if (!skipDefault && hasDefault) {
            if ("string".equals(type) && !FILE_DATA_TITLE.equals(title)
                && defaultValue instanceof Map<?, ?> map && map.get("url") instanceof String url) {
                defaultValue = url;
            }
            param = param.withDefault(defaultValue);
        }
        return param;
    }

    private static ParamSchema.Type typeOf(Object type) {
        if (!(type instanceof String name)) {
            return ParamSchema.Type.ANY;
        }
        return switch (name) {
            case "string" -> ParamSchema.Type.STRING;
            case "number" -> ParamSchema.Type.NUMBER;
            case "integer" -> ParamSchema.Type.INTEGER;
            case "boolean" -> ParamSchema.Type.BOOLEAN;
            case "array" -> ParamSchema.Type.ARRAY;
            case "object" -> ParamSchema.Type.OBJECT;
            default -> ParamSchema.Type.ANY;
        };
    }
}
