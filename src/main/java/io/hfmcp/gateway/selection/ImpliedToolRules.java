package io.hfmcp.gateway.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rules that enable a secondary tool whenever its primary tool is enabled.
 */
public class ImpliedToolRules {

    private static final Logger log = LoggerFactory.getLogger(ImpliedToolRules.class);

    /**
     * One primary to secondary implication, active only when {@code enabled}.
     */
    public record Rule(String primary, String secondary, boolean enabled) {
    }

    private final List<Rule> rules;

    public ImpliedToolRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ImpliedToolRules none() {
        return new ImpliedToolRules(List.of());
    }

    /**
     * Apply every enabled rule. Secondaries are appended in rule order and never duplicated.
     */
    public List<String> apply(List<String> enabledToolIds) {
        List<String> result = new ArrayList<>(enabledToolIds);
        for (Rule rule : rules) {
            if (rule.enabled() && result.contains(rule.primary()) && !result.contains(rule.secondary())) {
                log.debug("Enabling {} because {} is enabled", rule.secondary(), rule.primary());
                result.add(rule.secondary());
            }
        }
        return result;
    }

    public List<Rule> rules() {
        return rules;
    }
}
