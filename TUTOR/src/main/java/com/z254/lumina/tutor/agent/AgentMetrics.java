package com.z254.lumina.tutor.agent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling counters for one agent.
 */
public class AgentMetrics {

    private final int latencyWindow;
    private final Deque<Long> latencies = new ArrayDeque<>();
    private long messageCount;
    private long errorCount;
    private Instant lastProcessed;
    private Instant startedAt;

    public AgentMetrics(int latencyWindow) {
        this.latencyWindow = latencyWindow;
    }

    public synchronized void markStarted() {
        startedAt = Instant.now();
    }

    public synchronized void recordSuccess(long latencyMs) {
        record(latencyMs);
    }

    public synchronized void recordError(long latencyMs) {
        errorCount++;
        record(latencyMs);
    }

    public synchronized Snapshot snapshot() {
        double average = latencies.stream().mapToLong(Long::longValue).average().orElse(0.0);
        double errorRate = messageCount == 0 ? 0.0 : (double) errorCount / messageCount;
        Duration uptime = startedAt == null ? Duration.ZERO : Duration.between(startedAt, Instant.now());
        return new Snapshot(messageCount, errorCount, average, errorRate, lastProcessed, uptime);
    }

    private void record(long latencyMs) {
        messageCount++;
        lastProcessed = Instant.now();
        latencies.addLast(latencyMs);
        while (latencies.size() > latencyWindow) {
            latencies.pollFirst();
        }
    }

    /**
     * @param averageLatencyMs mean over the most recent latencies only
     * @param errorRate        errors divided by messages
     */
    public record Snapshot(long messageCount, long errorCount, double averageLatencyMs, double errorRate,
                           Instant lastProcessed, Duration uptime) {
    }
}
