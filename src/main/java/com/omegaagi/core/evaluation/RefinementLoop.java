package com.omegaagi.core.evaluation;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.engine.ExecutionState;
import com.omegaagi.core.error.ErrorKind;
import com.omegaagi.core.generation.PromptComposer;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.omegaagi.core.model.EvaluationCriteria;
import com.omegaagi.core.model.SectionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Raises a section's quality until it meets its {@link EvaluationCriteria}.
 * <p>
 * The first draft is scored; while no attempt has met the threshold and fewer than
 * {@code maxIterations} regenerations have run, the backend critiques the latest attempt
 * and writes a new one from that critique. The best-scoring attempt is kept, the
 * earliest one on ties. Failing to reach the threshold is not an error: the best
 * attempt is returned with a {@code QualityThresholdUnmet} warning.
 */
@Component
public class RefinementLoop {

    private static final Logger log = LoggerFactory.getLogger(RefinementLoop.class);

    private final LlmService llmService;
    private final SectionScorer scorer;
    private final PromptComposer composer;
    private final OmegaProperties properties;
    private final OmegaMetrics metrics;

    public RefinementLoop(LlmService llmService, SectionScorer scorer, PromptComposer composer,
                          OmegaProperties properties, OmegaMetrics metrics) {
        this.llmService = llmService;
        this.scorer = scorer;
        this.composer = composer;
        this.properties = properties;
        this.metrics = metrics;
    }

    public RefinementOutcome refine(ExecutionScope scope, ExecutionState state, SectionDirective section,
                                    Map<String, String> dependencyContent, String initialContent) {
        EvaluationCriteria criteria = section.evaluationCriteria()
                .orElseThrow(() -> new IllegalArgumentException("Section " + section.symbol() + " has no evaluation criteria"));
        String subject = "section " + section.symbol();

        String current = initialContent;
        int currentScore = scorer.score(scope, state.modelId(), section, current);
        String best = current;
        int bestScore = currentScore;
        int regenerations = 0;

        while (!criteria.isMetBy(bestScore) && regenerations < criteria.maxIterations()) {
            String feedbackPrompt = composer.composeFeedback(state.script(), section, current, currentScore, criteria);
            String feedback = llmService.call(scope, CallPurpose.FEEDBACK, subject, feedbackPrompt,
                    state.modelId(), properties.getEvaluationTemperature());

            String regeneratePrompt = composer.composeRegeneration(state.script(), section, dependencyContent,
                    current, feedback);
            current = llmService.call(scope, CallPurpose.REGENERATE, subject, regeneratePrompt,
                    state.modelId(), properties.getGenerationTemperature());
            regenerations++;

            currentScore = scorer.score(scope, state.modelId(), section, current);
            log.debug("Section {} regeneration {} scored {} (best {})",
                    section.symbol(), regenerations, currentScore, bestScore);
            if (currentScore > bestScore) {
                best = current;
                bestScore = currentScore;
            }
        }

        metrics.recordRefinementIterations(regenerations);
        metrics.recordSectionScore(bestScore);

        if (criteria.isMetBy(bestScore)) {
            log.info("Section {} met threshold {} with score {} after {} regeneration(s)",
                    section.symbol(), criteria.threshold(), bestScore, regenerations);
            return new RefinementOutcome(best, bestScore, regenerations, Optional.empty());
        }

        metrics.recordQualityThresholdUnmet();
        String warning = ErrorKind.QUALITY_THRESHOLD_UNMET.displayName() + ": section " + section.symbol()
                + " best score " + bestScore + " is below threshold " + criteria.threshold()
                + " after " + regenerations + " regeneration(s)";
        log.warn(warning);
        return new RefinementOutcome(best, bestScore, regenerations, Optional.of(warning));
    }
}
