package io.hfmcp.gateway.model;

import java.util.Map;

/**
 * One tool as advertised by a remote endpoint's schema.
 *
 * @param name the remote tool name, unsanitised
 * @param description the remote description, may be empty
 * @param inputSchema normalised JSON schema: {@code type}, {@code properties}, {@code required}
 */
public record RemoteToolSpec(
    String name,
    String description,
    Map<String, Object> inputSchema
) {

    public RemoteToolSpec {
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
    }
}
