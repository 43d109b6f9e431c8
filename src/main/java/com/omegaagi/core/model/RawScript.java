package com.omegaagi.core.model;

import java.util.Objects;

/**
 * The immutable script text given to one execution.
 */
public record RawScript(String text) {

    public RawScript {
        Objects.requireNonNull(text, "script text must not be null");
    }

    public static RawScript of(String text) {
        return new RawScript(text == null ? "" : text);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
