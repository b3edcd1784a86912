package io.hfmcp.gateway.proxy;

import io.hfmcp.gateway.model.RemoteEndpoint.Visibility;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates the local names of proxied tools.
 *
 * <p>A name is {@code gr<ordinal>_} (public endpoint) or {@code grp<ordinal>_} (private endpoint)
 * followed by the sanitised remote name. Names longer than the budget keep the first
 * {@code headLength} characters, then {@code _<toolIndex>_}, then as much of the end of the
 * sanitised name as still fits. Output depends only on the arguments.</p>
 */
public class ToolNameGenerator {

    public static final int MAX_LENGTH = 49;
    public static final int HEAD_LENGTH = 20;

    private static final Pattern PROXY_NAME = Pattern.compile("^grp?\\d+_");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");

    private final int maxLength;
    private final int headLength;

    public ToolNameGenerator() {
        this(MAX_LENGTH, HEAD_LENGTH);
    }

    public ToolNameGenerator(int maxLength, int headLength) {
        if (headLength < 1 || maxLength <= headLength) {
            throw new IllegalArgumentException("Name budget " + maxLength + " must exceed head length " + headLength);
        }
        this.maxLength = maxLength;
        this.headLength = headLength;
    }

    /**
     * Name a proxied tool.
     *
     * @param rawName remote tool name
     * @param ordinal 1-based position of the endpoint among the request's candidates
     * @param visibility endpoint visibility
     * @param toolIndex position of the tool within its endpoint
     * @return a name of at most {@code maxLength} characters
     */
    public String generate(String rawName, int ordinal, Visibility visibility, int toolIndex) {
        String prefix = prefix(ordinal, visibility);
        String sanitized = sanitize(rawName);
        if (prefix.length() + sanitized.length() <= maxLength) {
            return prefix + sanitized;
        }
        return truncate(prefix, sanitized, toolIndex);
    }

    /**
     * Name a proxied tool whose plain name collided with another tool of the same endpoint.
     * The tool index is always part of the result.
     */
    public String generateDisambiguated(String rawName, int ordinal, Visibility visibility, int toolIndex) {
        String prefix = prefix(ordinal, visibility);
        String sanitized = sanitize(rawName);
        String candidate = prefix + sanitized + "_" + toolIndex;
        if (candidate.length() <= maxLength) {
            return candidate;
        }
        return truncate(prefix, sanitized, toolIndex);
    }

    private String truncate(String prefix, String sanitized, int toolIndex) {
        String marker = "_" + toolIndex + "_";
        int available = maxLength - prefix.length() - marker.length();
        if (available < 1) {
            throw new IllegalArgumentException("Name budget " + maxLength + " too small for prefix " + prefix);
        }
        int head = Math.min(headLength, Math.min(available, sanitized.length()));
        int tail = Math.min(available - head, sanitized.length() - head);
        return prefix + sanitized.substring(0, head) + marker + sanitized.substring(sanitized.length() - tail);
    }

    public static String prefix(int ordinal, Visibility visibility) {
        return (visibility == Visibility.PRIVATE ? "grp" : "gr") + ordinal + "_";
    }

    /**
     * Replace every character outside {@code [A-Za-z0-9_]} with an underscore and lower-case.
     */
    public static String sanitize(String rawName) {
        if (rawName == null || rawName.isEmpty()) {
            return "unknown";
        }
        return INVALID_CHARS.matcher(rawName).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a tool name carries a proxy prefix.
     */
    public static boolean isProxyToolName(String toolName) {
        return toolName != null && PROXY_NAME.matcher(toolName).find();
    }

    public int getMaxLength() {
        return maxLength;
    }
}
