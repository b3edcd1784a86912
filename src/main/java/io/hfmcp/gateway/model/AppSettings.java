package io.hfmcp.gateway.model;

import java.util.List;

/**
 * Per-user tool settings: enabled local tool ids and configured remote endpoints.
 */
public record AppSettings(
    List<String> builtInTools,
    List<RemoteEndpoint> spaceTools
) {

    public AppSettings {
        builtInTools = builtInTools == null ? List.of() : List.copyOf(builtInTools);
        spaceTools = spaceTools == null ? List.of() : List.copyOf(spaceTools);
    }

    public static AppSettings of(List<String> builtInTools) {
        return new AppSettings(builtInTools, List.of());
    }
}
