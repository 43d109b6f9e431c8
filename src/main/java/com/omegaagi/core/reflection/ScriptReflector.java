package com.omegaagi.core.reflection;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmParseException;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.llm.OmegaPrompts;
import com.omegaagi.core.llm.ResponseText;
import com.omegaagi.core.model.ReflectionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the backend to critique a script's structure and to rewrite it from that critique.
 * <p>
 * The critique is requested as a {@link ScriptCritique}. A reply that is not valid JSON
 * is read as text: a {@code Score: N} marker and one recommendation per bullet line.
 */
@Service
public class ScriptReflector {

    private static final Logger log = LoggerFactory.getLogger(ScriptReflector.class);

    /** "- item", "* item", "1. item", "2) item" */
    private static final Pattern BULLET_PATTERN = Pattern.compile("^\\s*(?:[-*\\u2022]|\\d+[.)])\\s+(.+)$");

    private final LlmService llmService;
    private final OmegaProperties properties;

    public ScriptReflector(LlmService llmService, OmegaProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    public ReflectionReport reflect(String script, String modelHint) {
        requireScript(script);
        String prompt = OmegaPrompts.EXPERT_ROLE
                + " Evaluate the following Omega script for structure, assign a quality score from 1 to 100,"
                + " and provide detailed recommendations for improvement.\n\n"
                + OmegaPrompts.SYNTAX_GUIDE
                + "\nScript:\n" + script;
        ReflectionReport report;
        try {
            report = llmService.structuredCall(CallPurpose.REFLECT, "script", prompt,
                    properties.resolveModel(modelHint), properties.getEvaluationTemperature(),
                    ScriptCritique.class).toReport();
        } catch (LlmParseException e) {
            log.info("Reflection reply was not structured; reading it as text");
            report = parseReport(e.rawResponse());
        }
        log.info("Reflection scored script {} with {} recommendation(s)", report.score(),
                report.recommendations().size());
        return report;
    }

    /**
     * Rewrites a script. Without feedback, a reflection is run first and its critique used.
     */
    public String improve(String script, String feedback, Integer score, String modelHint) {
        requireScript(script);
        String critique = feedback;
        Integer knownScore = score;
        if (critique == null || critique.isBlank()) {
            var report = reflect(script, modelHint);
            critique = report.rawFeedback();
            knownScore = report.score();
        }
        var prompt = new StringBuilder(OmegaPrompts.EXPERT_ROLE)
                .append(" Correct and improve the following Omega script based on the provided feedback.\n\n")
                .append(OmegaPrompts.SYNTAX_GUIDE)
                .append("\nFeedback:\n").append(critique).append('\n');
        if (knownScore != null) {
            prompt.append("\nCurrent quality score: ").append(knownScore).append("/100\n");
        }
        prompt.append("\nScript:\n").append(script).append("\n\n").append(OmegaPrompts.SCRIPT_ONLY);
        return ResponseText.stripCodeFence(llmService.call(CallPurpose.IMPROVE, "script", prompt.toString(),
                properties.resolveModel(modelHint), properties.getCorrectionTemperature()));
    }

    static ReflectionReport parseReport(String reply) {
        String text = reply == null ? "" : reply.trim();
        var marker = ResponseText.scoreMarker(text);
        int score = 1;
        if (marker.isPresent()) {
            score = Math.max(1, Math.min(100, marker.getAsInt()));
        } else {
            log.warn("Reflection reply had no score; defaulting to 1");
        }

        List<String> recommendations = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher bullet = BULLET_PATTERN.matcher(line);
            if (bullet.matches()) {
                recommendations.add(bullet.group(1).trim());
            }
        }
        return new ReflectionReport(score, recommendations, text);
    }

    private static void requireScript(String script) {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("No script given");
        }
    }
}
