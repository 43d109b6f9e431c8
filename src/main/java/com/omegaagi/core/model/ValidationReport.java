package com.omegaagi.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating a script. A valid report carries the parsed script and its
 * generation order so that execution does not parse twice.
 */
public record ValidationReport(
    List<ValidationError> errors,
    ParsedScript parsedScript,
    List<String> generationOrder
) {

    public ValidationReport {
        errors = List.copyOf(errors);
        generationOrder = generationOrder == null ? List.of() : List.copyOf(generationOrder);
    }

    public static ValidationReport valid(ParsedScript parsedScript, List<String> generationOrder) {
        return new ValidationReport(List.of(), parsedScript, generationOrder);
    }

    public static ValidationReport invalid(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid report needs at least one error");
        }
        return new ValidationReport(errors, null, List.of());
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public Optional<ParsedScript> parsed() {
        return Optional.ofNullable(parsedScript);
    }
}
