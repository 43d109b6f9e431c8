package com.omegaagi.core.scanner;

import com.omegaagi.core.model.Symbol;
import com.omegaagi.core.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the symbol table from {@code DEFINE_SYMBOLS} blocks.
 * <p>
 * Entries look like {@code Q="Query"}, optionally followed by {@code : description}
 * or by a comment holding the description. Several blocks are merged in order.
 * A token defined twice keeps its first definition and is reported.
 */
@Component
public class SymbolTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(SymbolTableBuilder.class);

    public static final String BLOCK_NAME = "DEFINE_SYMBOLS";

    /** Characters that may not appear in a token. */
    static final String TOKEN = "[^\\s=:,;\"(){}\\[\\]<>]+";

    private static final Pattern ENTRY_PATTERN = Pattern.compile(
            "^(" + TOKEN + ")\\s*[=:]\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^\\s:\"]+))\\s*(?::\\s*(.*))?$",
            Pattern.DOTALL);

    /**
     * @param symbols tokens in definition order
     * @param errors  malformed or duplicate definitions
     */
    public record SymbolTable(Map<String, Symbol> symbols, List<ValidationError> errors) {

        public SymbolTable {
            symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
            errors = List.copyOf(errors);
        }
    }

    public SymbolTable build(List<ScannedBlock> blocks) {
        var symbols = new LinkedHashMap<String, Symbol>();
        var errors = new ArrayList<ValidationError>();

        for (var block : blocks) {
            for (var entry : EntrySplitter.split(block.body(), EntrySplitter.ENTRY_SEPARATORS)) {
                Matcher m = ENTRY_PATTERN.matcher(entry.code());
                if (!m.matches()) {
                    errors.add(ValidationError.structural("Malformed symbol definition '" + abbreviate(entry.code())
                            + "' in " + BLOCK_NAME + " at line " + block.line()));
                    continue;
                }
                String token = m.group(1);
                String label = m.group(2) != null ? EntrySplitter.unquote("\"" + m.group(2) + "\"") : m.group(3);
                String description = m.group(4) != null ? EntrySplitter.unquote(m.group(4)) : entry.comment();

                if (symbols.containsKey(token)) {
                    errors.add(ValidationError.structural("Symbol '" + token + "' is defined more than once"));
                    continue;
                }
                symbols.put(token, new Symbol(token, label, description));
            }
        }

        log.debug("Built symbol table with {} symbols ({} problems)", symbols.size(), errors.size());
        return new SymbolTable(symbols, errors);
    }

    static String abbreviate(String text) {
        String oneLine = text.replaceAll("\\s+", " ");
        return oneLine.length() <= 40 ? oneLine : oneLine.substring(0, 37) + "...";
    }
}
