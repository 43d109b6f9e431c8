package com.omegaagi.core.engine;

import com.omegaagi.core.assembly.OutputAssembler;
import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.correction.ScriptCorrector;
import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.error.ScriptValidationException;
import com.omegaagi.core.events.EventBus;
import com.omegaagi.core.events.OmegaEvent;
import com.omegaagi.core.generation.GenerationCoordinator;
import com.omegaagi.core.logging.MdcContext;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.omegaagi.core.model.CorrectionResult;
import com.omegaagi.core.model.ExecutionResult;
import com.omegaagi.core.model.ValidationReport;
import com.omegaagi.core.validation.ScriptValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running Omega scripts.
 * <p>
 * A script is validated before anything else, so a malformed script fails without a
 * single backend call. Each execution then gets its own {@link ExecutionScope} and
 * {@link ExecutionState}; nothing is shared between concurrent executions.
 * <p>
 * With {@code omega.auto-correct} enabled, an invalid script is repaired by the
 * {@link ScriptCorrector} instead of being rejected.
 */
@Service
public class OmegaInterpreter {

    private static final Logger log = LoggerFactory.getLogger(OmegaInterpreter.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);

    private final ScriptValidator validator;
    private final ScriptCorrector corrector;
    private final GenerationCoordinator coordinator;
    private final OutputAssembler assembler;
    private final EventBus eventBus;
    private final OmegaMetrics metrics;
    private final OmegaProperties properties;

    public OmegaInterpreter(ScriptValidator validator, ScriptCorrector corrector, GenerationCoordinator coordinator,
                            OutputAssembler assembler, EventBus eventBus, OmegaMetrics metrics,
                            OmegaProperties properties) {
        this.validator = validator;
        this.corrector = corrector;
        this.coordinator = coordinator;
        this.assembler = assembler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Checks a script without calling the backend.
     */
    public ValidationReport validate(String script) {
        var report = validator.validate(script);
        metrics.recordValidation(report.valid());
        return report;
    }

    public CorrectionResult correct(String script, String modelHint) {
        return corrector.correct(script, modelHint);
    }

    /**
     * Runs a script to completion on the calling thread.
     *
     * @param modelHint model to use; the configured default when null or blank
     * @throws ScriptValidationException if the script is invalid (and auto-correct is off)
     * @throws OmegaException            on backend or correction failure
     */
    public ExecutionResult execute(String script, String modelHint) {
        var report = prepare(script, modelHint);
        String modelId = properties.resolveModel(modelHint);
        try (var scope = new ExecutionScope(generateExecutionId(), properties.getMaxParallel())) {
            return run(scope, report, modelId);
        }
    }

    /**
     * Validates a script and runs it in the background.
     *
     * @throws ScriptValidationException if the script is invalid (and auto-correct is off)
     */
    public ExecutionHandle start(String script, String modelHint) {
        var report = prepare(script, modelHint);
        String modelId = properties.resolveModel(modelHint);
        String executionId = generateExecutionId();
        var scope = new ExecutionScope(executionId, properties.getMaxParallel());

        Executor driver = task -> {
            var thread = new Thread(task, executionId + "-driver");
            thread.setDaemon(true);
            thread.start();
        };
        CompletableFuture<ExecutionResult> result = CompletableFuture
                .supplyAsync(() -> run(scope, report, modelId), driver)
                .whenComplete((ignored, failure) -> scope.close());
        return new ExecutionHandle(executionId, result, scope);
    }

    private ValidationReport prepare(String script, String modelHint) {
        var report = validate(script);
        if (report.valid()) {
            return report;
        }
        if (!properties.isAutoCorrect()) {
            throw new ScriptValidationException(report.errors());
        }
        log.info("Script invalid ({} error(s)); auto-correcting", report.errors().size());
        CorrectionResult corrected = corrector.correct(script, modelHint);
        return validator.validate(corrected.correctedScript());
    }

    private ExecutionResult run(ExecutionScope scope, ValidationReport report, String modelId) {
        String executionId = scope.executionId();
        var script = report.parsed()
                .orElseThrow(() -> new IllegalStateException("Cannot run an invalid script"));
        MdcContext.setExecution(executionId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting execution {} with model {}: {} section(s), generation order {}",
                    executionId, modelId, script.sections().size(), report.generationOrder());
            eventBus.publish(OmegaEvent.of(OmegaEvent.EXECUTION_STARTED, executionId, null,
                    Map.of("model", modelId, "sections", script.sections().size())));

            var state = new ExecutionState(executionId, script, modelId);
            coordinator.generateAll(scope, state, report.generationOrder());
            var result = assembler.assemble(state, properties.getSectionSeparator());

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordExecutionResult("completed", elapsed);
            eventBus.publish(OmegaEvent.of(OmegaEvent.EXECUTION_COMPLETED, executionId, null,
                    Map.of("chars", result.text().length(), "warnings", result.warnings().size())));
            log.info("Execution {} completed in {}ms with {} warning(s)", executionId, elapsed,
                    result.warnings().size());
            return result;
        } catch (OmegaException e) {
            metrics.recordExecutionResult("failed", System.currentTimeMillis() - start);
            eventBus.publish(OmegaEvent.of(OmegaEvent.EXECUTION_FAILED, executionId, null,
                    Map.of("error", e.kind().displayName(), "message", e.getMessage())));
            log.warn("Execution {} failed with {}: {}", executionId, e.kind().displayName(), e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique execution ID in the format OMGA-YYYY-NNNN.
     */
    public String generateExecutionId() {
        int count = EXECUTION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("OMGA-%d-%04d", year, count);
    }
}
