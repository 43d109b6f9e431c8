package com.omegaagi.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.omegaagi.core.model.ValidationReport;

import java.util.List;

/**
 * Outbound JSON for POST /api/v1/omega/validate.
 */
public record ValidationResponse(
    boolean valid,
    List<ErrorEntry> errors,
    @JsonProperty("generation_order") List<String> generationOrder
) {

    public record ErrorEntry(String kind, String message) {}

    public static ValidationResponse from(ValidationReport report) {
        var errors = report.errors().stream()
                .map(error -> new ErrorEntry(error.kind().displayName(), error.message()))
                .toList();
        return new ValidationResponse(report.valid(), errors, report.generationOrder());
    }
}
