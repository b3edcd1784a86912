package io.hfmcp.gateway.selection;

import io.hfmcp.gateway.model.RemoteEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the {@code gradio} request parameter: a comma-separated list of {@code owner/space} names.
 */
public final class GradioEndpointParser {

    private static final Logger log = LoggerFactory.getLogger(GradioEndpointParser.class);

    static final String PARAMETER_EMOJI = "🔧";

    private GradioEndpointParser() {
    }

    /**
     * Parse the parameter. Entries without exactly one {@code /} are skipped with a warning.
     *
     * @param parameter the raw parameter value, may be null
     * @return the endpoints in parameter order
     */
    public static List<RemoteEndpoint> parse(String parameter) {
        List<RemoteEndpoint> endpoints = new ArrayList<>();
        if (parameter == null || parameter.isBlank() || "none".equalsIgnoreCase(parameter.trim())) {
            return endpoints;
        }
        for (String raw : parameter.split(",")) {
            String entry = raw.trim();
            if (entry.isEmpty()) {
                continue;
            }
            if (entry.chars().filter(c -> c == '/').count() != 1) {
                log.warn("Skipping invalid gradio entry \"{}\": must contain exactly one slash", entry);
                continue;
            }
            String subdomain = subdomainOf(entry);
            endpoints.add(RemoteEndpoint.builder()
                .id("gradio_" + subdomain)
                .name(entry)
                .subdomain(subdomain)
                .emoji(PARAMETER_EMOJI)
                .build());
            log.debug("Added gradio endpoint {} -> {}", entry, subdomain);
        }
        return endpoints;
    }

    /**
     * Host label of a space: {@code owner/my_space.v2} becomes {@code owner-my-space-v2}.
     */
    public static String subdomainOf(String spaceName) {
        return spaceName.replaceAll("[/._]", "-");
    }
}
