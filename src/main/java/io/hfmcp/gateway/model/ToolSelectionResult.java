package io.hfmcp.gateway.model;

import java.util.List;

/**
 * Result of tool selection for one request.
 *
 * <p>{@code mixedBouquet} and {@code baseSettings} are only set in {@link ToolSelectionMode#MIX}
 * mode and in settings modes respectively.</p>
 */
public record ToolSelectionResult(
    ToolSelectionMode mode,
    List<String> enabledToolIds,
    List<RemoteEndpoint> remoteEndpoints,
    String mixedBouquet,
    AppSettings baseSettings,
    String reason
) {

    public ToolSelectionResult {
        enabledToolIds = enabledToolIds == null ? List.of() : List.copyOf(enabledToolIds);
        remoteEndpoints = remoteEndpoints == null ? List.of() : List.copyOf(remoteEndpoints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ToolSelectionMode mode;
        private List<String> enabledToolIds = List.of();
        private List<RemoteEndpoint> remoteEndpoints = List.of();
        private String mixedBouquet;
        private AppSettings baseSettings;
        private String reason;

        public Builder mode(ToolSelectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder enabledToolIds(List<String> enabledToolIds) {
            this.enabledToolIds = enabledToolIds;
            return this;
        }

        public Builder remoteEndpoints(List<RemoteEndpoint> remoteEndpoints) {
            this.remoteEndpoints = remoteEndpoints;
            return this;
        }

        public Builder mixedBouquet(String mixedBouquet) {
            this.mixedBouquet = mixedBouquet;
            return this;
        }

        public Builder baseSettings(AppSettings baseSettings) {
            this.baseSettings = baseSettings;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public ToolSelectionResult build() {
            return new ToolSelectionResult(mode, enabledToolIds, remoteEndpoints, mixedBouquet, baseSettings, reason);
        }
    }
}
