package com.omegaagi.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link OmegaMetrics}.
 */
class OmegaMetricsTest {

    private SimpleMeterRegistry registry;
    private OmegaMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OmegaMetrics(registry);
    }

    @Test
    @DisplayName("counts validations by result")
    void validations() {
        metrics.recordValidation(true);
        metrics.recordValidation(false);
        metrics.recordValidation(false);

        assertEquals(1.0, registry.get("omega.validations.total").tag("result", "valid").counter().count());
        assertEquals(2.0, registry.get("omega.validations.total").tag("result", "invalid").counter().count());
    }

    @Test
    @DisplayName("records execution outcome and duration")
    void executions() {
        metrics.recordExecutionResult("completed", 1500);

        assertEquals(1.0, registry.get("omega.executions.total").tag("status", "completed").counter().count());
        var timer = registry.get("omega.execution.duration").tag("status", "completed").timer();
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("tags backend calls by purpose and outcome")
    void backendCalls() {
        metrics.recordBackendCall("generate", "success", 10);
        metrics.recordBackendCall("generate", "retry", 10);
        metrics.recordBackendCall("score", "success", 10);

        assertEquals(1, registry.get("omega.backend.calls")
                .tag("purpose", "generate").tag("outcome", "success").timer().count());
        assertEquals(2, registry.get("omega.backend.calls").tag("outcome", "success").timers().size());
    }

    @Test
    @DisplayName("records refinement and correction figures")
    void refinementAndCorrection() {
        metrics.recordRefinementIterations(2);
        metrics.recordSectionScore(85);
        metrics.recordQualityThresholdUnmet();
        metrics.recordCorrection(false, 3);

        assertEquals(2.0, registry.get("omega.refinement.iterations").summary().totalAmount());
        assertEquals(85.0, registry.get("omega.refinement.score").summary().max());
        assertEquals(1.0, registry.get("omega.refinement.threshold_unmet").counter().count());
        assertEquals(1.0, registry.get("omega.corrections.total").tag("result", "exhausted").counter().count());
        assertEquals(3.0, registry.get("omega.correction.attempts").summary().totalAmount());
    }
}
