package com.ghlinker.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BotMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new BotMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.tasksFailed());
        assertNotNull(metrics.tasksSuppressed());
        assertNotNull(metrics.deletionOutcome("deleted"));
    }

    @Test
    void outcomeCountersAreTaggedSeparately() {
        var metrics = new BotMetrics();
        metrics.deletionOutcome("deleted").increment();
        metrics.deletionOutcome("deleted").increment();
        metrics.deletionOutcome("expired").increment();
        assertEquals(2.0, metrics.deletionOutcome("deleted").count());
        assertEquals(1.0, metrics.deletionOutcome("expired").count());
    }
}
