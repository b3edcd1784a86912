package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.model.AppSettings;

/**
 * Source of per-user tool settings.
 */
public interface SettingsProvider {

    /**
     * Look up the settings for a caller.
     *
     * @param token the caller's token, may be null
     * @return the settings, or null when none are available; never throws
     */
    AppSettings getSettings(String token);

    /**
     * Whether settings come from an external settings service.
     */
    boolean isExternal();
}
