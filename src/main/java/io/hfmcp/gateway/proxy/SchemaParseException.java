package io.hfmcp.gateway.proxy;

/**
 * A remote endpoint's schema document could not be turned into tools.
 */
public class SchemaParseException extends RuntimeException {

    public static final String NO_TOOLS = "No tools found in schema";
    public static final String INVALID_FORMAT = "Invalid schema format: expected array or object";

    public SchemaParseException(String message) {
        super(message);
    }
}
