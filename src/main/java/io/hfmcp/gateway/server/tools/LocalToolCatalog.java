package io.hfmcp.gateway.server.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All local tools known to the gateway, by id.
 */
@Component
public class LocalToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(LocalToolCatalog.class);

    private final Map<String, LocalTool> tools = new LinkedHashMap<>();

    public LocalToolCatalog(List<LocalTool> tools) {
        for (LocalTool tool : tools) {
            if (this.tools.putIfAbsent(tool.id(), tool) != null) {
                throw new IllegalStateException("Duplicate local tool id: " + tool.id());
            }
        }
        log.info("Registered {} local tools: {}", this.tools.size(), this.tools.keySet());
    }

    public Optional<LocalTool> find(String id) {
        return Optional.ofNullable(tools.get(id));
    }

    public List<String> ids() {
        return List.copyOf(tools.keySet());
    }
}
