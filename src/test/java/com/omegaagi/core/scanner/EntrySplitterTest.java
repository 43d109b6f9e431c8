package com.omegaagi.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntrySplitterTest {

    @Test
    @DisplayName("splits on commas, semicolons and newlines at the top level only")
    void splitsAtTopLevel() {
        var entries = EntrySplitter.split("A -> [B, C]; D -> E\nF -> G", EntrySplitter.ENTRY_SEPARATORS);
        assertEquals(3, entries.size());
        assertEquals("A -> [B, C]", entries.get(0).code());
        assertEquals("D -> E", entries.get(1).code());
        assertEquals("F -> G", entries.get(2).code());
    }

    @Test
    @DisplayName("separators inside strings do not split")
    void stringsKeepSeparators() {
        var entries = EntrySplitter.split("Q, d=\"first, second\"", EntrySplitter.ARGUMENT_SEPARATORS);
        assertEquals(2, entries.size());
        assertEquals("d=\"first, second\"", entries.get(1).code());
    }

    @Test
    @DisplayName("comments are removed from the entry and returned with it")
    void commentsExtracted() {
        var entries = EntrySplitter.split("Q=\"Query\" // what to ask\nA=\"Answer\" /* reply */",
                EntrySplitter.ENTRY_SEPARATORS);
        assertEquals(2, entries.size());
        assertEquals("Q=\"Query\"", entries.get(0).code());
        assertEquals("what to ask", entries.get(0).comment());
        assertEquals("A=\"Answer\"", entries.get(1).code());
        assertEquals("reply", entries.get(1).comment());
    }

    @Test
    @DisplayName("blank entries are dropped")
    void blankEntriesDropped() {
        var entries = EntrySplitter.split("\n\n  A ,, \n", EntrySplitter.ENTRY_SEPARATORS);
        assertEquals(1, entries.size());
        assertEquals("", entries.get(0).comment());
    }

    @Test
    @DisplayName("unquote strips one pair of quotes and resolves escapes")
    void unquote() {
        assertEquals("say \"hi\"", EntrySplitter.unquote("\"say \\\"hi\\\"\""));
        assertEquals("two\nlines", EntrySplitter.unquote("\"two\\nlines\""));
        assertEquals("bare", EntrySplitter.unquote("  bare "));
        assertEquals("\"", EntrySplitter.unquote("\""));
    }
}
