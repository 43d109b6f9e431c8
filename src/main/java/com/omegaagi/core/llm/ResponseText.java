package com.omegaagi.core.llm;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for free-form backend output.
 */
public final class ResponseText {

    /** "Score: 85", "**Score:** 85", "score = 85/100", "\"score\": 85" */
    static final Pattern SCORE_MARKER = Pattern.compile("(?i)\\bscore\\b[*_\"\\s]*[:=][*_\"\\s]*(\\d{1,3})\\b");

    /** A reply made of nothing but a number, e.g. "85" or "85/100". */
    private static final Pattern BARE_SCORE = Pattern.compile("^[*_\\s]*(\\d{1,3})\\s*(?:/\\s*100)?[*_.\\s]*$");

    private ResponseText() {}

    /**
     * The number after the first {@code Score:} marker, markdown emphasis allowed, or the
     * reply itself when it is a bare number. Other numbers in the text are never taken.
     */
    public static OptionalInt scoreMarker(String text) {
        if (text == null || text.isBlank()) {
            return OptionalInt.empty();
        }
        Matcher matcher = SCORE_MARKER.matcher(text);
        if (matcher.find()) {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        }
        matcher = BARE_SCORE.matcher(text.trim());
        return matcher.matches() ? OptionalInt.of(Integer.parseInt(matcher.group(1))) : OptionalInt.empty();
    }

    /**
     * Removes a surrounding markdown code fence (with or without a language tag), if present.
     */
    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.trim();
        if (!cleaned.startsWith("```")) {
            return cleaned;
        }
        int firstNewline = cleaned.indexOf('\n');
        cleaned = firstNewline < 0 ? cleaned.substring(3) : cleaned.substring(firstNewline + 1);
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
