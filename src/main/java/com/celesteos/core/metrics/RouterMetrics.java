package com.celesteos.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for routing decisions.
 */
@Service
public class RouterMetrics {

    private final MeterRegistry registry;

    public RouterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLane(String lane) {
        Counter.builder("celeste.classify.lanes")
                .description("Classified queries by lane")
                .tag("lane", lane)
                .register(registry)
                .increment();
    }

    /**
     * @param reason terminal reason code of the guard or input check that stopped the query
     */
    public void recordGuardHit(String reason) {
        Counter.builder("celeste.guard.hits")
                .description("Queries stopped by a guard")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDuration(long ms) {
        Timer.builder("celeste.classify.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordEntityCount(int count) {
        DistributionSummary.builder("celeste.extract.entity_count")
                .register(registry)
                .record(count);
    }
}
