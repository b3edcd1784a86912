package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.model.AppSettings;
import io.hfmcp.gateway.model.RemoteEndpoint;
import io.hfmcp.gateway.model.ToolSelectionMode;
import io.hfmcp.gateway.model.ToolSelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which local tools and remote endpoints a request gets.
 *
 * <p>Precedence, first match wins:</p>
 * <ol>
 *   <li>bouquet override</li>
 *   <li>mix of a bouquet into the user's settings</li>
 *   <li>the user's settings alone</li>
 *   <li>fallback to every known tool</li>
 * </ol>
 * <p>Implied-tool rules are applied to the result of every mode.</p>
 */
public class ToolSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ToolSelectionStrategy.class);

    private final BouquetCatalog bouquets;
    private final ImpliedToolRules impliedTools;
    private final SettingsProvider settingsProvider;
    private final String defaultToken;

    public ToolSelectionStrategy(BouquetCatalog bouquets, ImpliedToolRules impliedTools,
                                 SettingsProvider settingsProvider, String defaultToken) {
        this.bouquets = bouquets;
        this.impliedTools = impliedTools;
        this.settingsProvider = settingsProvider;
        this.defaultToken = defaultToken;
    }

    /**
     * Select tools for a request.
     *
     * @param headers normalised request headers
     * @param userSettings caller-supplied settings; when null the settings provider is consulted
     * @param token caller token used for the settings lookup, may be null
     * @return the selection
     */
    public ToolSelectionResult selectTools(Map<String, String> headers, AppSettings userSettings, String token) {
        RequestContext context = RequestContext.from(headers, defaultToken);
        List<RemoteEndpoint> parameterEndpoints = GradioEndpointParser.parse(context.gradio());
        String gradioSuffix = parameterEndpoints.isEmpty() ? "" : " + " + parameterEndpoints.size() + " gradio endpoints";

        Optional<List<String>> bouquet = bouquets.find(context.bouquet());
        if (bouquet.isPresent()) {
            List<String> enabled = impliedTools.apply(bouquet.get());
            log.debug("Using bouquet override {}: {}", context.bouquet(), enabled);
            return ToolSelectionResult.builder()
                .mode(ToolSelectionMode.BOUQUET_OVERRIDE)
                .enabledToolIds(enabled)
                .remoteEndpoints(parameterEndpoints)
                .reason("Bouquet override: " + context.bouquet() + gradioSuffix)
                .build();
        }

        AppSettings baseSettings = userSettings != null ? userSettings : settingsProvider.getSettings(token);

        Optional<List<String>> mix = bouquets.find(context.mix());
        if (mix.isPresent() && baseSettings != null) {
            Set<String> union = new LinkedHashSet<>(baseSettings.builtInTools());
            union.addAll(mix.get());
            List<String> enabled = impliedTools.apply(new ArrayList<>(union));
            log.debug("Applying mix {} to {} base tools: {} tools", context.mix(),
                baseSettings.builtInTools().size(), enabled.size());
            return ToolSelectionResult.builder()
                .mode(ToolSelectionMode.MIX)
                .enabledToolIds(enabled)
                .remoteEndpoints(mergeEndpoints(baseSettings.spaceTools(), parameterEndpoints))
                .mixedBouquet(context.mix())
                .baseSettings(baseSettings)
                .reason("User settings + mix(" + context.mix() + ")" + gradioSuffix)
                .build();
        }

        if (baseSettings != null) {
            boolean external = userSettings == null && settingsProvider.isExternal();
            ToolSelectionMode mode = external ? ToolSelectionMode.EXTERNAL_SETTINGS : ToolSelectionMode.INTERNAL_SETTINGS;
            List<String> enabled = impliedTools.apply(baseSettings.builtInTools());
            log.debug("Using {} user settings: {}", external ? "external" : "internal", enabled);
            return ToolSelectionResult.builder()
                .mode(mode)
                .enabledToolIds(enabled)
                .remoteEndpoints(mergeEndpoints(baseSettings.spaceTools(), parameterEndpoints))
                .baseSettings(baseSettings)
                .reason((external ? "External" : "Internal") + " user settings" + gradioSuffix)
                .build();
        }

        log.warn("No settings available, using fallback (all tools enabled)");
        return ToolSelectionResult.builder()
            .mode(ToolSelectionMode.FALLBACK)
            .enabledToolIds(impliedTools.apply(bouquets.allToolIds()))
            .remoteEndpoints(parameterEndpoints)
            .reason("Fallback - no settings available" + gradioSuffix)
            .build();
    }

    /**
     * Settings endpoints first, then parameter endpoints; the first endpoint per subdomain wins.
     */
    static List<RemoteEndpoint> mergeEndpoints(List<RemoteEndpoint> fromSettings, List<RemoteEndpoint> fromParameter) {
        List<RemoteEndpoint> merged = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<RemoteEndpoint> source : List.of(fromSettings, fromParameter)) {
            for (RemoteEndpoint endpoint : source) {
                String key = endpoint.hasAddress() ? endpoint.subdomain() : endpoint.name();
                if (seen.add(key)) {
                    merged.add(endpoint);
                }
            }
        }
        return merged;
    }
}
