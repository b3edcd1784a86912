package io.hfmcp.gateway.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Success and failure counters per proxied tool name.
 */
public class RemoteToolMetrics {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public void recordSuccess(String toolName) {
        counter(toolName).success.incrementAndGet();
    }

    public void recordFailure(String toolName) {
        counter(toolName).failure.incrementAndGet();
    }

    public ToolStats get(String toolName) {
        Counter counter = counters.get(toolName);
        return counter == null ? new ToolStats(0, 0) : counter.snapshot();
    }

    public Map<String, ToolStats> snapshot() {
        Map<String, ToolStats> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.snapshot()));
        return snapshot;
    }

    private Counter counter(String toolName) {
        return counters.computeIfAbsent(toolName, name -> new Counter());
    }

    public record ToolStats(long success, long failure) {
    }

    private static final class Counter {
        private final AtomicLong success = new AtomicLong();
        private final AtomicLong failure = new AtomicLong();

        ToolStats snapshot() {
            return new ToolStats(success.get(), failure.get());
        }
    }
}
