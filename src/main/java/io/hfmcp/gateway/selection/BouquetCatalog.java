package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.server.tools.ToolIds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named, predefined sets of local tool ids.
 *
 * <p>The {@code all} bouquet always contains every known tool id.</p>
 */
public class BouquetCatalog {

    public static final String ALL = "all";

    private final Map<String, List<String>> bouquets;
    private final List<String> allToolIds;

    public BouquetCatalog(Map<String, List<String>> bouquets, List<String> allToolIds) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        bouquets.forEach((name, ids) -> copy.put(name, List.copyOf(ids)));
        copy.put(ALL, List.copyOf(allToolIds));
        this.bouquets = Collections.unmodifiableMap(copy);
        this.allToolIds = List.copyOf(allToolIds);
    }

    /**
     * Catalog with the default bouquets, overlaid with configured ones.
     *
     * @param overrides configured bouquets; an entry replaces the default of the same name
     */
    public static BouquetCatalog withDefaults(Map<String, List<String>> overrides) {
        Map<String, List<String>> bouquets = new LinkedHashMap<>(defaultBouquets());
        if (overrides != null) {
            overrides.forEach((name, ids) -> {
                if (!ALL.equals(name)) {
                    bouquets.put(name, ids);
                }
            });
        }
        return new BouquetCatalog(bouquets, ToolIds.ALL);
    }

    static Map<String, List<String>> defaultBouquets() {
        Map<String, List<String>> bouquets = new LinkedHashMap<>();
        bouquets.put("search", List.of(
            ToolIds.SPACE_SEARCH, ToolIds.MODEL_SEARCH, ToolIds.DATASET_SEARCH, ToolIds.PAPER_SEARCH,
            ToolIds.DOC_SEARCH));
        bouquets.put("hf_api", List.of(
            ToolIds.MODEL_SEARCH, ToolIds.DATASET_SEARCH, ToolIds.PAPER_SEARCH, ToolIds.REPO_DETAILS));
        bouquets.put("spaces", List.of(ToolIds.SPACE_SEARCH));
        bouquets.put("docs", List.of(ToolIds.DOC_SEARCH, ToolIds.DOC_FETCH));
        bouquets.put("jobs", List.of(ToolIds.JOBS));
        return bouquets;
    }

    public Optional<List<String>> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bouquets.get(name));
    }

    public List<String> allToolIds() {
        return allToolIds;
    }

    public Map<String, List<String>> bouquets() {
        return bouquets;
    }
}
