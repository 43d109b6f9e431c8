package com.omegaagi.core.scanner;

import com.omegaagi.core.model.RawScript;
import com.omegaagi.core.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Locates top-level blocks by balanced-delimiter matching.
 * <p>
 * Double-quoted strings and comments ({@code /* ... *}{@code /} and {@code // ...})
 * are skipped while matching, so delimiters inside them never count. Free text and
 * identifiers not followed by a delimiter are ignored. Scanning stops at the first
 * block that cannot be closed, because everything after it belongs to that block.
 */
@Component
public class ScriptScanner {

    private static final Logger log = LoggerFactory.getLogger(ScriptScanner.class);

    public ScanResult scan(RawScript script) {
        String text = script.text();
        var blocks = new ArrayList<ScannedBlock>();
        var errors = new ArrayList<ValidationError>();
        int n = text.length();
        int i = 0;

        while (i < n) {
            char c = text.charAt(i);
            if (startsBlockComment(text, i)) {
                int end = skipBlockComment(text, i);
                if (end < 0) {
                    errors.add(ValidationError.structural("Unclosed comment starting at line " + lineOf(text, i)));
                    break;
                }
                i = end;
            } else if (startsLineComment(text, i)) {
                i = skipLineComment(text, i);
            } else if (c == '"') {
                int end = skipString(text, i);
                if (end < 0) {
                    errors.add(ValidationError.structural("Unclosed string starting at line " + lineOf(text, i)));
                    break;
                }
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int nameEnd = i + 1;
                while (nameEnd < n && (Character.isLetterOrDigit(text.charAt(nameEnd)) || text.charAt(nameEnd) == '_')) {
                    nameEnd++;
                }
                int j = nameEnd;
                // the opening delimiter may sit on the next line
                while (j < n && Character.isWhitespace(text.charAt(j))) {
                    j++;
                }
                if (j < n && isOpener(text.charAt(j))) {
                    String name = text.substring(i, nameEnd);
                    int close = findClose(text, j, name, errors);
                    if (close < 0) {
                        break;
                    }
                    blocks.add(new ScannedBlock(name, text.charAt(j), text.substring(j + 1, close), lineOf(text, i)));
                    i = close + 1;
                } else {
                    i = nameEnd;
                }
            } else if (isOpener(c)) {
                int close = findClose(text, i, null, errors);
                if (close < 0) {
                    break;
                }
                i = close + 1;
            } else if (isCloser(c)) {
                errors.add(ValidationError.structural(
                        "Unexpected '" + c + "' at line " + lineOf(text, i) + " with no matching opening delimiter"));
                i++;
            } else {
                i++;
            }
        }

        log.debug("Scanned {} chars: {} blocks, {} structural errors", n, blocks.size(), errors.size());
        return new ScanResult(blocks, errors);
    }

    /**
     * Returns the index of the delimiter closing the one at {@code openIndex}, or -1 after
     * recording why it could not be found.
     */
    private int findClose(String text, int openIndex, String owner, List<ValidationError> errors) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(openIndex);
        int n = text.length();
        int i = openIndex + 1;
        while (i < n) {
            char c = text.charAt(i);
            if (startsBlockComment(text, i)) {
                int end = skipBlockComment(text, i);
                if (end < 0) {
                    errors.add(ValidationError.structural("Unclosed comment starting at line " + lineOf(text, i)));
                    return -1;
                }
                i = end;
                continue;
            }
            if (startsLineComment(text, i)) {
                i = skipLineComment(text, i);
                continue;
            }
            if (c == '"') {
                int end = skipString(text, i);
                if (end < 0) {
                    errors.add(ValidationError.structural("Unclosed string starting at line " + lineOf(text, i)));
                    return -1;
                }
                i = end;
                continue;
            }
            if (isOpener(c)) {
                stack.push(i);
            } else if (isCloser(c)) {
                int top = stack.peek();
                char expected = closerFor(text.charAt(top));
                if (c != expected) {
                    errors.add(ValidationError.structural("Mismatched '" + c + "' at line " + lineOf(text, i)
                            + ": expected '" + expected + "' to close '" + text.charAt(top)
                            + "' opened at line " + lineOf(text, top)));
                    return -1;
                }
                stack.pop();
                if (stack.isEmpty()) {
                    return i;
                }
            }
            i++;
        }
        int innermost = stack.peek();
        String subject = innermost == openIndex && owner != null ? " opened by " + owner : "";
        errors.add(ValidationError.structural("Unclosed '" + text.charAt(innermost) + "'" + subject
                + " at line " + lineOf(text, innermost)));
        return -1;
    }

    static boolean isOpener(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    static boolean isCloser(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    static char closerFor(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> throw new IllegalArgumentException("Not an opening delimiter: " + open);
        };
    }

    static boolean startsBlockComment(String text, int i) {
        return text.startsWith("/*", i);
    }

    static boolean startsLineComment(String text, int i) {
        return text.startsWith("//", i);
    }

    /** Index just past the closing marker, or -1 when the comment never closes. */
    static int skipBlockComment(String text, int start) {
        int end = text.indexOf("*/", start + 2);
        return end < 0 ? -1 : end + 2;
    }

    static int skipLineComment(String text, int start) {
        int end = text.indexOf('\n', start);
        return end < 0 ? text.length() : end;
    }

    /** Index just past the closing quote, or -1 when the string never closes. */
    static int skipString(String text, int start) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    static int lineOf(String text, int index) {
        int line = 1;
        for (int i = 0; i < index && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
