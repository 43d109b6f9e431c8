package com.omegaagi.core.scanner;

/**
 * A top-level {@code NAME(...)}, {@code NAME[...]} or {@code NAME{...}} found by the scanner.
 *
 * @param name  the identifier preceding the opening delimiter
 * @param open  the opening delimiter character
 * @param body  raw text between the delimiters, comments included
 * @param line  1-based line of the identifier
 */
public record ScannedBlock(
    String name,
    char open,
    String body,
    int line
) {

    public char close() {
        return ScriptScanner.closerFor(open);
    }

    /**
     * The block as it appeared in the script, without surrounding whitespace.
     */
    public String raw() {
        return name + open + body + close();
    }

    public boolean isNamed(String expected) {
        return name.equals(expected);
    }
}
