package com.omegaagi.core.model;

import com.omegaagi.core.error.ErrorKind;

import java.io.Serializable;

/**
 * A single problem found in a script before any backend call.
 */
public record ValidationError(
    ErrorKind kind,
    String message
) implements Serializable {

    public static ValidationError structural(String message) {
        return new ValidationError(ErrorKind.STRUCTURAL, message);
    }

    public static ValidationError undefinedSymbol(String message) {
        return new ValidationError(ErrorKind.UNDEFINED_SYMBOL, message);
    }

    public static ValidationError cyclicDependency(String message) {
        return new ValidationError(ErrorKind.CYCLIC_DEPENDENCY, message);
    }

    @Override
    public String toString() {
        return kind.displayName() + ": " + message;
    }
}
