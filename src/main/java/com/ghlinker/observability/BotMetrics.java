package com.ghlinker.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class BotMetrics {

    private final MeterRegistry registry;

    public BotMetrics() {
        this(new SimpleMeterRegistry());
    }

    public BotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter tasksFailed() {
        return Counter.builder("ghlinker.tasks.failed").register(registry);
    }

    public Counter tasksSuppressed() {
        return Counter.builder("ghlinker.tasks.suppressed").register(registry);
    }

    public Counter deletionOutcome(String outcome) {
        return Counter.builder("ghlinker.deletion.outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
