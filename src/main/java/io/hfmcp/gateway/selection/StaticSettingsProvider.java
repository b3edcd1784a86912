package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.model.AppSettings;
import io.hfmcp.gateway.model.RemoteEndpoint;

import java.util.List;

/**
 * Settings from local configuration, identical for every caller.
 */
public class StaticSettingsProvider implements SettingsProvider {

    private final AppSettings settings;

    /**
     * @param enabledToolIds configured tool ids, or null when no settings are configured
     * @param endpoints configured remote endpoints
     */
    public StaticSettingsProvider(List<String> enabledToolIds, List<RemoteEndpoint> endpoints) {
        this.settings = enabledToolIds == null ? null : new AppSettings(enabledToolIds, endpoints);
    }

    @Override
    public AppSettings getSettings(String token) {
        return settings;
    }

    @Override
    public boolean isExternal() {
        return false;
    }
}
