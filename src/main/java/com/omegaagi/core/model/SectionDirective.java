package com.omegaagi.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A {@code WR_SECT} instruction to generate one unit of output.
 * <p>
 * Directives are immutable; the generated content lives in the per-execution
 * accumulator, keyed by {@link #symbol()}.
 *
 * @param symbol           the referenced symbol token
 * @param title            optional title; empty when absent
 * @param description      free-text instructions for the section
 * @param constraints      any further {@code key=value} arguments, in script order
 * @param evaluation       criteria from a matching {@code EVAL_SECT}, if any
 * @param declarationOrder zero-based position among the script's section directives
 */
public record SectionDirective(
    String symbol,
    String title,
    String description,
    Map<String, String> constraints,
    EvaluationCriteria evaluation,
    int declarationOrder
) {

    public SectionDirective {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        constraints = constraints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    }

    public Optional<EvaluationCriteria> evaluationCriteria() {
        return Optional.ofNullable(evaluation);
    }

    public SectionDirective withEvaluation(EvaluationCriteria criteria) {
        return new SectionDirective(symbol, title, description, constraints, criteria, declarationOrder);
    }
}
