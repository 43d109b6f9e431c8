package com.omegaagi.core.error;

import com.omegaagi.core.model.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a script fails validation. Its kind is that of the first error found.
 */
public class ScriptValidationException extends OmegaException {

    private final List<ValidationError> errors;

    public ScriptValidationException(List<ValidationError> errors) {
        super(errors.get(0).kind(), summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }

    private static String summarize(List<ValidationError> errors) {
        return errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; ", "Script is invalid: ", ""));
    }
}
