package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.protocol.InputSchema;
import io.hfmcp.gateway.protocol.ParamSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaConverterTest {

    private final JsonSchemaConverter converter = new JsonSchemaConverter();

    @Test
    void mapsPrimitiveTypes() {
        assertThat(converter.convertProperty(Map.of("type", "string"), false).type()).isEqualTo(ParamSchema.Type.STRING);
        assertThat(converter.convertProperty(Map.of("type", "integer"), false).type()).isEqualTo(ParamSchema.Type.INTEGER);
        assertThat(converter.convertProperty(Map.of("type", "array"), false).type()).isEqualTo(ParamSchema.Type.ARRAY);
        assertThat(converter.convertProperty(Map.of("type", "null"), false).type()).isEqualTo(ParamSchema.Type.ANY);
        assertThat(converter.convertProperty(Map.of(), false).type()).isEqualTo(ParamSchema.Type.ANY);
    }

    @Test
    void fileDataTitleBecomesStructuredFileSchema() {
        ParamSchema param = converter.convertProperty(Map.of("title", "FileData", "type", "object"), false);

        assertThat(param.type()).isEqualTo(ParamSchema.Type.FILE_DATA);
        assertThat(param.description()).isEqualTo(JsonSchemaConverter.FILE_HINT);
    }

    @Test
    void fileUrlWithObjectDefaultIsFileData() {
        ParamSchema param = converter.convertProperty(Map.of(
            "type", "string",
            "format", JsonSchemaConverter.FILE_URL_FORMAT,
            "default", Map.of("path", "cat.png")), false);

        assertThat(param.type()).isEqualTo(ParamSchema.Type.FILE_DATA);
    }

    @Test
    void fileUrlStringGetsFileHint() {
        ParamSchema param = converter.convertProperty(Map.of(
            "type", "string",
            "format", JsonSchemaConverter.FILE_URL_FORMAT,
            "description", "Input image"), false);

        assertThat(param.type()).isEqualTo(ParamSchema.Type.STRING);
        assertThat(param.description()).isEqualTo("Input image (" + JsonSchemaConverter.FILE_HINT + ")");
    }

    @Test
    void objectDefaultWithUrlCollapsesToUrl() {
        ParamSchema param = converter.convertProperty(Map.of(
            "type", "string",
            "default", Map.of("url", "https://example.com/a.wav", "path", "a.wav")), false);

        assertThat(param.hasDefault()).isTrue();
        assertThat(param.defaultValue()).isEqualTo("https://example.com/a.wav");
    }

    @Test
    void requiredFieldsIgnoreDefaults() {
        InputSchema schema = converter.convertInputSchema(Map.of(
            "type", "object",
            "properties", Map.of(
                "prompt", Map.of("type", "string", "default", "a cat"),
                "steps", Map.of("type", "integer", "default", 4),
                "seed", Map.of("type", "integer")),
            "required", List.of("prompt")));

        assertThat(schema.properties().get("prompt").isOptional()).isFalse();
        assertThat(schema.properties().get("prompt").hasDefault()).isFalse();
        assertThat(schema.properties().get("steps").defaultValue()).isEqualTo(4);
        assertThat(schema.properties().get("seed").isOptional()).isTrue();
        assertThat(schema.validate(Map.of("prompt", "a dog"))).containsEntry("steps", 4).doesNotContainKey("seed");
    }

    @Test
    void missingPropertiesGiveEmptySchema() {
        assertThat(converter.convertInputSchema(Map.of("type", "object")).properties()).isEmpty();
    }
}
