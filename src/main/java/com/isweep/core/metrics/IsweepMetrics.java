package com.isweep.core.metrics;

import com.isweep.core.model.Decision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for playback decisions.
 */
@Service
public class IsweepMetrics {

    private final MeterRegistry registry;

    public IsweepMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a returned decision by action and matched category.
     *
     * @param mode "simple" for /api/analyze, "structured" for /event
     */
    public void recordDecision(String mode, Decision decision) {
        Counter.builder("isweep.decisions.total")
                .tag("mode", mode)
                .tag("action", decision.action().wireName())
                .tag("category", decision.matchedCategory() != null
                        ? decision.matchedCategory().wireName() : "none")
                .register(registry)
                .increment();
    }

    public void recordDecisionDuration(long nanos) {
        Timer.builder("isweep.decision.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    /**
     * @param reason "not_found", "timeout", "error" or "interrupted"
     */
    public void recordLookupFailure(String reason) {
        Counter.builder("isweep.preferences.lookup.failures")
                .description("Preference lookups that fell back to no action")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPayloadRejection() {
        Counter.builder("isweep.payload.rejections")
                .description("Decision requests rejected as malformed")
                .register(registry)
                .increment();
    }
}
