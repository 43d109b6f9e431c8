package com.omegaagi.core.llm;

/**
 * Why a backend call is made; used for log lines, metric tags and error messages.
 */
public enum CallPurpose {
    GENERATE("generate"),
    FEEDBACK("critique"),
    REGENERATE("regenerate"),
    SCORE("score"),
    CORRECT("correct script"),
    HUMAN_TO_OMEGA("translate to Omega"),
    OMEGA_TO_HUMAN("explain script"),
    REFLECT("reflect on script"),
    IMPROVE("improve script");

    private final String verb;

    CallPurpose(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }

    public String tag() {
        return name().toLowerCase();
    }
}
