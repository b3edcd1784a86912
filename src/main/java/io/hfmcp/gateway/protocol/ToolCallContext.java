package io.hfmcp.gateway.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call context handed to tool handlers.
 *
 * @param requestId id of the {@code tools/call} request
 * @param progressToken the caller's progress token, or {@code null} when progress was not requested
 * @param notifications channel for notifications back to the caller
 */
public record ToolCallContext(
    Object requestId,
    Object progressToken,
    NotificationSink notifications
) {

    public ToolCallContext {
        notifications = notifications == null ? NotificationSink.DISCARD : notifications;
    }

    public void notify(String method, Map<String, Object> params) {
        notifications.send(JsonRpcMessage.request(null, method, params));
    }

    /**
     * Send a progress notification. Does nothing when the caller supplied no progress token.
     */
    public void progress(Number progress, Number total, String message) {
        if (progressToken == null) {
            return;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("progressToken", progressToken);
        params.put("progress", progress);
        if (total != null) {
            params.put("total", total);
        }
        if (message != null) {
            params.put("message", message);
        }
        notify("notifications/progress", params);
    }
}
