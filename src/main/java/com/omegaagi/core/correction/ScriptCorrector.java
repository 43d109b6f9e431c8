package com.omegaagi.core.correction;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.error.CorrectionExhaustedException;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.llm.OmegaPrompts;
import com.omegaagi.core.llm.ResponseText;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.omegaagi.core.model.CorrectionResult;
import com.omegaagi.core.model.ValidationError;
import com.omegaagi.core.validation.ScriptValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Repairs an invalid script by asking the backend to fix it, at most
 * {@code omega.max-correction-attempts} times.
 * <p>
 * Each round sends the latest candidate together with the errors the validator found
 * in it, then validates the reply. An input that is already valid is returned as is
 * without calling the backend.
 */
@Service
public class ScriptCorrector {

    private static final Logger log = LoggerFactory.getLogger(ScriptCorrector.class);
    private static final AtomicInteger CORRECTION_COUNTER = new AtomicInteger(0);

    private final LlmService llmService;
    private final ScriptValidator validator;
    private final OmegaProperties properties;
    private final OmegaMetrics metrics;

    public ScriptCorrector(LlmService llmService, ScriptValidator validator, OmegaProperties properties,
                           OmegaMetrics metrics) {
        this.llmService = llmService;
        this.validator = validator;
        this.properties = properties;
        this.metrics = metrics;
    }

    public CorrectionResult correct(String script) {
        return correct(script, null);
    }

    /**
     * @throws CorrectionExhaustedException if no round produced a valid script
     */
    public CorrectionResult correct(String script, String modelHint) {
        var report = validator.validate(script);
        if (report.valid()) {
            log.debug("Script already valid; no correction needed");
            return new CorrectionResult(script, 0);
        }

        String modelId = properties.resolveModel(modelHint);
        int maxAttempts = properties.getMaxCorrectionAttempts();
        String candidate = script;
        List<ValidationError> errors = report.errors();

        try (var scope = new ExecutionScope("omega-correct-" + CORRECTION_COUNTER.incrementAndGet(), 1)) {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                log.info("Correction attempt {}/{} for {} error(s)", attempt, maxAttempts, errors.size());
                String reply = llmService.call(scope, CallPurpose.CORRECT, "script", repairPrompt(candidate, errors),
                        modelId, properties.getCorrectionTemperature());
                candidate = ResponseText.stripCodeFence(reply);

                var check = validator.validate(candidate);
                if (check.valid()) {
                    log.info("Script corrected after {} attempt(s)", attempt);
                    metrics.recordCorrection(true, attempt);
                    return new CorrectionResult(candidate, attempt);
                }
                errors = check.errors();
            }
        }

        log.warn("Correction exhausted after {} attempt(s); {} error(s) remain", maxAttempts, errors.size());
        metrics.recordCorrection(false, maxAttempts);
        throw new CorrectionExhaustedException(maxAttempts, errors);
    }

    static String repairPrompt(String script, List<ValidationError> errors) {
        var prompt = new StringBuilder();
        prompt.append(OmegaPrompts.EXPERT_ROLE)
                .append(" Correct the following Omega script so that it fixes every listed error.\n\n")
                .append(OmegaPrompts.SYNTAX_GUIDE)
                .append("\nErrors:\n");
        errors.forEach(error -> prompt.append("- ").append(error).append('\n'));
        prompt.append("\nScript:\n").append(script).append("\n\n").append(OmegaPrompts.SCRIPT_ONLY);
        return prompt.toString();
    }
}
