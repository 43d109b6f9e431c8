package com.omegaagi.core.evaluation;

import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.model.SectionDirective;

/**
 * Assigns a 0..100 quality score to a section's content.
 */
public interface SectionScorer {

    int score(ExecutionScope scope, String modelId, SectionDirective section, String content);
}
