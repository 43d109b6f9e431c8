package com.omegaagi.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for script validation and execution.
 */
@Service
public class OmegaMetrics {

    private final MeterRegistry registry;

    public OmegaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordValidation(boolean valid) {
        Counter.builder("omega.validations.total")
                .tag("result", valid ? "valid" : "invalid")
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(String status, long ms) {
        Counter.builder("omega.executions.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("omega.execution.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSectionDuration(long ms) {
        Timer.builder("omega.section.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one backend call.
     *
     * @param purpose what the call was for, e.g. "generate" or "score"
     * @param outcome "success", "retry", "refused" or "failed"
     */
    public void recordBackendCall(String purpose, String outcome, long ms) {
        Timer.builder("omega.backend.calls")
                .description("Calls to the text generation backend")
                .tag("purpose", purpose)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how many regenerations a section with evaluation criteria needed.
     */
    public void recordRefinementIterations(int iterations) {
        DistributionSummary.builder("omega.refinement.iterations")
                .register(registry)
                .record(iterations);
    }

    public void recordSectionScore(int score) {
        DistributionSummary.builder("omega.refinement.score")
                .register(registry)
                .record(score);
    }

    public void recordQualityThresholdUnmet() {
        Counter.builder("omega.refinement.threshold_unmet")
                .description("Sections returned below their quality threshold")
                .register(registry)
                .increment();
    }

    public void recordCorrection(boolean succeeded, int attempts) {
        Counter.builder("omega.corrections.total")
                .tag("result", succeeded ? "corrected" : "exhausted")
                .register(registry)
                .increment();
        DistributionSummary.builder("omega.correction.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordLogSinkFailure() {
        Counter.builder("omega.logsink.failures")
                .description("Interaction records the log sink failed to store")
                .register(registry)
                .increment();
    }
}
