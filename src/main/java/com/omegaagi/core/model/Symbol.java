package com.omegaagi.core.model;

/**
 * A short token declared in the {@code DEFINE_SYMBOLS} block.
 *
 * @param token       the token as written in the script (e.g. "Q")
 * @param label       human-readable label (e.g. "Query")
 * @param description optional free-text description; empty when absent
 */
public record Symbol(
    String token,
    String label,
    String description
) {

    public Symbol {
        description = description == null ? "" : description;
    }

    public boolean hasDescription() {
        return !description.isBlank();
    }
}
