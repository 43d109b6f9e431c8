package com.omegaagi.core.error;

import com.omegaagi.core.model.ValidationError;

import java.util.List;

/**
 * Every repair round still produced an invalid script.
 */
public class CorrectionExhaustedException extends OmegaException {

    private final int attempts;
    private final List<ValidationError> remainingErrors;

    public CorrectionExhaustedException(int attempts, List<ValidationError> remainingErrors) {
        super(ErrorKind.CORRECTION_EXHAUSTED,
                "Script still invalid after " + attempts + " correction attempt" + (attempts == 1 ? "" : "s")
                        + " (" + remainingErrors.size() + " error" + (remainingErrors.size() == 1 ? "" : "s")
                        + " remaining)");
        this.attempts = attempts;
        this.remainingErrors = List.copyOf(remainingErrors);
    }

    public int attempts() {
        return attempts;
    }

    public List<ValidationError> remainingErrors() {
        return remainingErrors;
    }
}
