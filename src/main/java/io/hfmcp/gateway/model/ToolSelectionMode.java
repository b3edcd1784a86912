package io.hfmcp.gateway.model;

/**
 * How the enabled tool set of a request was decided.
 */
public enum ToolSelectionMode {
    BOUQUET_OVERRIDE,
    MIX,
    EXTERNAL_SETTINGS,
    INTERNAL_SETTINGS,
    FALLBACK
}
