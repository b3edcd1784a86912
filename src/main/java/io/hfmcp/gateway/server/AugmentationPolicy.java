package io.hfmcp.gateway.server;

import io.hfmcp.gateway.model.ToolSelectionMode;
import io.hfmcp.gateway.model.ToolSelectionResult;
import io.hfmcp.gateway.selection.BouquetCatalog;
import io.hfmcp.gateway.selection.RequestContext;

/**
 * Whether a server instance gets proxied remote tools added. Only {@link #ALWAYS} augments.
 */
public enum AugmentationPolicy {
    /** Add remote tools. */
    ALWAYS,
    /** Handshake or local-only call; remote tools are not needed. */
    NEVER,
    /** A bouquet other than {@code all} was forced. */
    UNLESS_BOUQUET_ALL,
    /** The request sent {@code gradio=none}. */
    EXPLICITLY_DISABLED;

    public boolean augments() {
        return this == ALWAYS;
    }

    /**
     * Narrow a requested policy by what the request asked for.
     *
     * @param requested the policy chosen by the transport
     * @param context request values
     * @param selection the tool selection made for the request
     * @return the effective policy
     */
    public static AugmentationPolicy resolve(AugmentationPolicy requested, RequestContext context,
                                             ToolSelectionResult selection) {
        if (requested != ALWAYS) {
            return requested;
        }
        if (context.gradioDisabled()) {
            return EXPLICITLY_DISABLED;
        }
        if (selection.mode() == ToolSelectionMode.BOUQUET_OVERRIDE
            && !BouquetCatalog.ALL.equals(context.bouquet())) {
            return UNLESS_BOUQUET_ALL;
        }
        return ALWAYS;
    }
}
