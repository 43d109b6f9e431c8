package com.omegaagi.core.assembly;

import com.omegaagi.core.engine.ExecutionState;
import com.omegaagi.core.model.ExecutionResult;
import com.omegaagi.core.model.SectionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;

/**
 * Joins generated sections into the final text.
 * <p>
 * Sections appear in declaration order, whatever order they were generated in.
 * Warnings are collected in the same order. A section with no content keeps its place
 * and adds an {@code EmptySectionOutput} warning.
 */
@Component
public class OutputAssembler {

    private static final Logger log = LoggerFactory.getLogger(OutputAssembler.class);

    static final String EMPTY_SECTION_WARNING = "EmptySectionOutput";

    public ExecutionResult assemble(ExecutionState state, String separator) {
        var sections = new ArrayList<>(state.script().sections());
        sections.sort(Comparator.comparingInt(SectionDirective::declarationOrder));

        var parts = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        for (SectionDirective section : sections) {
            String content = state.content(section.symbol()).orElse("");
            parts.add(content);
            warnings.addAll(state.warningsFor(section.symbol()));
            if (content.isBlank()) {
                warnings.add(EMPTY_SECTION_WARNING + ": section " + section.symbol() + " produced no content");
            }
        }

        String text = String.join(separator, parts);
        log.debug("Assembled {} sections ({} chars, {} warnings)", parts.size(), text.length(), warnings.size());
        return new ExecutionResult(text, warnings);
    }
}
