package com.omegaagi.core.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a block body into entries on top-level separators.
 * <p>
 * Separators inside strings, comments or nested delimiters do not split. Comment text
 * is removed from the entry and returned alongside it.
 */
public final class EntrySplitter {

    /** Separators for block bodies such as {@code DEFINE_SYMBOLS} and {@code MEM_GRAPH}. */
    public static final String ENTRY_SEPARATORS = ",;\n";

    /** Separators for argument lists such as {@code WR_SECT(...)}. */
    public static final String ARGUMENT_SEPARATORS = ",";

    private EntrySplitter() {}

    /**
     * @param code    entry text with comments removed, trimmed
     * @param comment concatenated comment text, trimmed; empty when there was none
     */
    public record Entry(String code, String comment) {

        public boolean isBlank() {
            return code.isBlank();
        }
    }

    public static List<Entry> split(String body, String separators) {
        var entries = new ArrayList<Entry>();
        var code = new StringBuilder();
        var comment = new StringBuilder();
        int depth = 0;
        int i = 0;
        int n = body.length();

        while (i < n) {
            char c = body.charAt(i);
            if (ScriptScanner.startsBlockComment(body, i)) {
                int end = ScriptScanner.skipBlockComment(body, i);
                if (end < 0) {
                    end = n;
                }
                appendComment(comment, body.substring(i + 2, Math.max(i + 2, end - 2)));
                i = end;
                continue;
            }
            if (ScriptScanner.startsLineComment(body, i)) {
                int end = ScriptScanner.skipLineComment(body, i);
                appendComment(comment, body.substring(i + 2, end));
                i = end;
                continue;
            }
            if (c == '"') {
                int end = ScriptScanner.skipString(body, i);
                if (end < 0) {
                    end = n;
                }
                code.append(body, i, end);
                i = end;
                continue;
            }
            if (ScriptScanner.isOpener(c)) {
                depth++;
            } else if (ScriptScanner.isCloser(c)) {
                depth = Math.max(0, depth - 1);
            }
            if (depth == 0 && separators.indexOf(c) >= 0) {
                flush(entries, code, comment);
            } else {
                code.append(c);
            }
            i++;
        }
        flush(entries, code, comment);
        return entries;
    }

    /**
     * Removes one pair of surrounding double quotes and resolves backslash escapes.
     * Unquoted values are returned trimmed and otherwise unchanged.
     */
    public static String unquote(String value) {
        String v = value.trim();
        if (v.length() < 2 || v.charAt(0) != '"' || v.charAt(v.length() - 1) != '"') {
            return v;
        }
        var out = new StringBuilder();
        for (int i = 1; i < v.length() - 1; i++) {
            char c = v.charAt(i);
            if (c == '\\' && i + 1 < v.length() - 1) {
                char next = v.charAt(++i);
                out.append(switch (next) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> next;
                });
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static void appendComment(StringBuilder comment, String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        if (comment.length() > 0) {
            comment.append(' ');
        }
        comment.append(trimmed);
    }

    private static void flush(List<Entry> entries, StringBuilder code, StringBuilder comment) {
        String entryCode = code.toString().trim();
        if (!entryCode.isEmpty()) {
            entries.add(new Entry(entryCode, comment.toString()));
        }
        code.setLength(0);
        comment.setLength(0);
    }
}
