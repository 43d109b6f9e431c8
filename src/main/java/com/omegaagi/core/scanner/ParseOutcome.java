package com.omegaagi.core.scanner;

import com.omegaagi.core.model.ParsedScript;
import com.omegaagi.core.model.ValidationError;

import java.util.List;

/**
 * A best-effort parse: the script as far as it could be understood, the entry-level
 * problems found, and every symbol reference still to be checked.
 */
public record ParseOutcome(
    ParsedScript script,
    List<ValidationError> errors,
    List<SymbolReference> references
) {

    public ParseOutcome {
        errors = List.copyOf(errors);
        references = List.copyOf(references);
    }
}
