package com.omegaagi.core.error;

/**
 * Closed taxonomy of failures an execution can report.
 */
public enum ErrorKind {
    STRUCTURAL("StructuralError", true),
    UNDEFINED_SYMBOL("UndefinedSymbolError", true),
    CYCLIC_DEPENDENCY("CyclicDependencyError", true),
    BACKEND_UNAVAILABLE("BackendUnavailableError", false),
    BACKEND_REFUSAL("BackendRefusalError", false),
    CORRECTION_EXHAUSTED("CorrectionExhaustedError", false),
    /** Never thrown; only attached to results as a warning. */
    QUALITY_THRESHOLD_UNMET("QualityThresholdUnmet", false);

    private final String displayName;
    private final boolean detectedFromText;

    ErrorKind(String displayName, boolean detectedFromText) {
        this.displayName = displayName;
        this.detectedFromText = detectedFromText;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True for kinds found purely from the script text, before any backend call.
     */
    public boolean isDetectedFromText() {
        return detectedFromText;
    }
}
