package io.hfmcp.gateway.protocol;

import java.util.Map;

/**
 * Delivers server-to-client notifications on whatever channel the transport has open.
 */
@FunctionalInterface
public interface NotificationSink {

    NotificationSink DISCARD = notification -> {
    };

    void send(Map<String, Object> notification);
}
