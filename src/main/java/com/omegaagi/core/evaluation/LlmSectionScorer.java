package com.omegaagi.core.evaluation;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmParseException;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.llm.ResponseText;
import com.omegaagi.core.model.SectionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores section content by asking the backend for a {@link SectionScore}.
 * <p>
 * When the reply is not valid JSON, a {@code Score: N} marker in the text is used
 * instead; failing that, the score is 0. Scores are clamped to 0..100.
 */
@Component
public class LlmSectionScorer implements SectionScorer {

    private static final Logger log = LoggerFactory.getLogger(LlmSectionScorer.class);

    private final LlmService llmService;
    private final OmegaProperties properties;

    public LlmSectionScorer(LlmService llmService, OmegaProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public int score(ExecutionScope scope, String modelId, SectionDirective section, String content) {
        String prompt = """
                Rate how well the content below fulfils its instructions, from 0 (useless) to 100 (perfect),
                and justify the score in one sentence.

                Instructions for section %s:
                %s

                Content:
                %s
                """.formatted(section.symbol(), instructions(section), content);
        int score;
        try {
            var verdict = llmService.structuredCall(scope, CallPurpose.SCORE, "section " + section.symbol(),
                    prompt, modelId, properties.getEvaluationTemperature(), SectionScore.class);
            score = clamp(verdict.score());
        } catch (LlmParseException e) {
            score = parseScore(e.rawResponse());
            log.info("Scoring reply for section {} was not structured; read score {} from text",
                    section.symbol(), score);
        }
        log.debug("Section {} scored {}", section.symbol(), score);
        return score;
    }

    static int parseScore(String reply) {
        var marker = ResponseText.scoreMarker(reply);
        if (marker.isEmpty()) {
            log.warn("No score found in scoring reply; treating as score 0");
            return 0;
        }
        return clamp(marker.getAsInt());
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static String instructions(SectionDirective section) {
        String text = section.title().isBlank() ? section.description()
                : section.title() + ". " + section.description();
        return text.isBlank() ? "(no further instructions)" : text;
    }
}
