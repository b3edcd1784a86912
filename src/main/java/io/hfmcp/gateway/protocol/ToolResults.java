package io.hfmcp.gateway.protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factories for {@code tools/call} results.
 */
public final class ToolResults {

    private ToolResults() {
    }

    public static Map<String, Object> text(String text) {
        return result(text, false);
    }

    public static Map<String, Object> error(String text) {
        return result(text, true);
    }

    public static boolean isError(Map<String, Object> result) {
        return result != null && Boolean.TRUE.equals(result.get("isError"));
    }

    private static Map<String, Object> result(String text, boolean isError) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", List.of(Map.of("type", "text", "text", text)));
        if (isError) {
            result.put("isError", true);
        }
        return result;
    }
}
