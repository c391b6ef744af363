package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.config.TutorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Query counters and a rolling window of query processing times.
 */
@Component
public class OrchestratorMetrics {

    private final Counter queriesCounter;
    private final Counter queriesFailedCounter;
    private final Counter lateResponsesCounter;
    private final Timer queryTimer;
    private final int window;
    private final Deque<Long> recentQueryTimes = new ArrayDeque<>();

    private long totalQueries;
    private long failedQueries;

    public OrchestratorMetrics(MeterRegistry registry, TutorProperties properties) {
        this.queriesCounter = Counter.builder("tutor.queries")
                .description("Total student queries processed")
                .register(registry);
        this.queriesFailedCounter = Counter.builder("tutor.queries.failed")
                .description("Queries answered with the degraded response")
                .register(registry);
        this.lateResponsesCounter = Counter.builder("tutor.responses.late")
                .description("Agent responses discarded because nobody was waiting")
                .register(registry);
        this.queryTimer = Timer.builder("tutor.query.latency")
                .description("End-to-end query processing time")
                .register(registry);
        this.window = properties.getOrchestrator().getQueryTimeWindow();
    }

    public synchronized void recordQuery(long processingTimeMs, boolean failed) {
        totalQueries++;
        queriesCounter.increment();
        if (failed) {
            failedQueries++;
            queriesFailedCounter.increment();
        }
        queryTimer.record(Duration.ofMillis(processingTimeMs));
        recentQueryTimes.addLast(processingTimeMs);
        while (recentQueryTimes.size() > window) {
            recentQueryTimes.removeFirst();
        }
    }

    public void recordLateResponse() {
        lateResponsesCounter.increment();
    }

    public synchronized double getAverageQueryTimeMs() {
        return recentQueryTimes.stream().mapToLong(Long::longValue).average().orElse(0);
    }

    public synchronized Map<String, Object> snapshot() {
        return Map.of(
                "totalQueries", totalQueries,
                "failedQueries", failedQueries,
                "averageQueryTimeMs", getAverageQueryTimeMs(),
                "lateResponses", (long) lateResponsesCounter.count());
    }
}
