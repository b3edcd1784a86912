package io.hfmcp.gateway;

import io.hfmcp.gateway.metrics.RemoteToolMetrics;
import io.hfmcp.gateway.metrics.TransportMetrics;
import io.hfmcp.gateway.model.TransportType;

import java.time.Clock;

/**
 * Process-wide state shared by the transport, the server factory and the proxy tools.
 */
public record GatewayContext(
    TransportType transportType,
    TransportMetrics transportMetrics,
    RemoteToolMetrics remoteToolMetrics,
    Clock clock
) {

    public static GatewayContext create(TransportType transportType, Clock clock) {
        return new GatewayContext(transportType, new TransportMetrics(clock), new RemoteToolMetrics(), clock);
    }
}
