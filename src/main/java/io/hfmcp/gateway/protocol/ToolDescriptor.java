package io.hfmcp.gateway.protocol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A callable tool as registered on a server instance.
 */
public record ToolDescriptor(
    String name,
    String title,
    String description,
    InputSchema inputSchema,
    Map<String, Object> annotations,
    ToolHandler handler
) {

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    /**
     * Entry for a {@code tools/list} response.
     */
    public Map<String, Object> toListEntry() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        if (title != null) {
            entry.put("title", title);
        }
        if (description != null) {
            entry.put("description", description);
        }
        entry.put("inputSchema", inputSchema.toJsonSchema());
        if (!annotations.isEmpty()) {
            entry.put("annotations", annotations);
        }
        return entry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String title;
        private String description;
        private InputSchema inputSchema = InputSchema.empty();
        private final Map<String, Object> annotations = new LinkedHashMap<>();
        private ToolHandler handler;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputSchema(InputSchema inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder annotation(String key, Object value) {
            this.annotations.put(key, value);
            return this;
        }

        public Builder readOnly() {
            return annotation("readOnlyHint", true).annotation("openWorldHint", true);
        }

        public Builder handler(ToolHandler handler) {
            this.handler = handler;
            return this;
        }

        public ToolDescriptor build() {
            return new ToolDescriptor(name, title, description, inputSchema, annotations, handler);
        }
    }
}
