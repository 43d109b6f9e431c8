package com.omegaagi.core.scanner;

import com.omegaagi.core.model.EvaluationCriteria;
import com.omegaagi.core.model.MemoryGraphEdge;
import com.omegaagi.core.model.SectionDirective;
import com.omegaagi.core.model.ValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the argument lists of {@code WR_SECT}, {@code EVAL_SECT} and the entries of
 * {@code MEM_GRAPH}. Problems are collected into the supplied error list; symbol tokens
 * are collected as references for the caller to check.
 */
@Component
public class DirectiveParser {

    public static final String SECTION_DIRECTIVE = "WR_SECT";
    public static final String EVALUATION_DIRECTIVE = "EVAL_SECT";
    public static final String MEMORY_GRAPH = "MEM_GRAPH";

    private static final Pattern NAMED_ARGUMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern TOKEN_PATTERN = Pattern.compile("^" + SymbolTableBuilder.TOKEN + "$");
    private static final Pattern ARROW = Pattern.compile("\\s*(?:->|→)\\s*");

    private static final Set<String> TITLE_KEYS = Set.of("t", "title");
    private static final Set<String> DESCRIPTION_KEYS = Set.of("d", "desc", "description");
    private static final Set<String> THRESHOLD_KEYS = Set.of("th", "threshold");
    private static final Set<String> ITERATION_KEYS = Set.of("iter", "iterations", "max_iter", "maxiterations");

    /**
     * Parses every {@code WR_SECT} block in order. Duplicate tokens keep the first directive.
     */
    public List<SectionDirective> parseSections(List<ScannedBlock> blocks, List<ValidationError> errors,
                                                List<SymbolReference> references) {
        var sections = new ArrayList<SectionDirective>();
        var seen = new LinkedHashSet<String>();

        for (var block : blocks) {
            String site = SECTION_DIRECTIVE + " at line " + block.line();
            var args = EntrySplitter.split(block.body(), EntrySplitter.ARGUMENT_SEPARATORS);
            if (args.isEmpty() || NAMED_ARGUMENT.matcher(args.get(0).code()).matches()) {
                errors.add(ValidationError.structural(site + " does not name a symbol"));
                continue;
            }
            String token = EntrySplitter.unquote(args.get(0).code());
            if (!TOKEN_PATTERN.matcher(token).matches()) {
                errors.add(ValidationError.structural(site + " names an invalid symbol '"
                        + SymbolTableBuilder.abbreviate(token) + "'"));
                continue;
            }
            references.add(new SymbolReference(token, site));

            String title = "";
            var description = new StringBuilder();
            var constraints = new LinkedHashMap<String, String>();
            for (var arg : args.subList(1, args.size())) {
                Matcher named = NAMED_ARGUMENT.matcher(arg.code());
                if (!named.matches()) {
                    appendSentence(description, EntrySplitter.unquote(arg.code()));
                    continue;
                }
                String key = named.group(1).toLowerCase(Locale.ROOT);
                String value = EntrySplitter.unquote(named.group(2));
                if (TITLE_KEYS.contains(key)) {
                    title = value;
                } else if (DESCRIPTION_KEYS.contains(key)) {
                    appendSentence(description, value);
                } else {
                    constraints.put(named.group(1), value);
                }
            }

            if (!seen.add(token)) {
                errors.add(ValidationError.structural("Section '" + token + "' is written more than once (" + site + ")"));
                continue;
            }
            sections.add(new SectionDirective(token, title, description.toString(), constraints, null, sections.size()));
        }
        return sections;
    }

    /**
     * Parses every {@code EVAL_SECT} block into criteria keyed by section token.
     * Missing arguments fall back to the given defaults.
     */
    public Map<String, EvaluationCriteria> parseEvaluations(List<ScannedBlock> blocks, int defaultThreshold,
                                                            int defaultMaxIterations, List<ValidationError> errors,
                                                            List<SymbolReference> references) {
        var criteria = new LinkedHashMap<String, EvaluationCriteria>();

        for (var block : blocks) {
            String site = EVALUATION_DIRECTIVE + " at line " + block.line();
            var args = EntrySplitter.split(block.body(), EntrySplitter.ARGUMENT_SEPARATORS);
            if (args.isEmpty() || NAMED_ARGUMENT.matcher(args.get(0).code()).matches()) {
                errors.add(ValidationError.structural(site + " does not name a section"));
                continue;
            }
            String token = EntrySplitter.unquote(args.get(0).code());
            references.add(new SymbolReference(token, site));

            Integer threshold = null;
            Integer iterations = null;
            int positional = 0;
            boolean malformed = false;
            for (var arg : args.subList(1, args.size())) {
                Matcher named = NAMED_ARGUMENT.matcher(arg.code());
                String key;
                String value;
                if (named.matches()) {
                    key = named.group(1).toLowerCase(Locale.ROOT);
                    value = EntrySplitter.unquote(named.group(2));
                } else {
                    key = positional++ == 0 ? "th" : "iter";
                    value = EntrySplitter.unquote(arg.code());
                }
                Integer parsed = parseInteger(value);
                if (THRESHOLD_KEYS.contains(key) || ITERATION_KEYS.contains(key)) {
                    if (parsed == null) {
                        errors.add(ValidationError.structural(site + " has a non-numeric " + key + " '"
                                + SymbolTableBuilder.abbreviate(value) + "'"));
                        malformed = true;
                    } else if (THRESHOLD_KEYS.contains(key)) {
                        threshold = parsed;
                    } else {
                        iterations = parsed;
                    }
                }
            }
            if (malformed) {
                continue;
            }

            int th = threshold != null ? threshold : defaultThreshold;
            int iter = iterations != null ? iterations : defaultMaxIterations;
            if (th < 0 || th > 100) {
                errors.add(ValidationError.structural(site + " threshold " + th + " is outside 0..100"));
                continue;
            }
            if (iter < 1) {
                errors.add(ValidationError.structural(site + " iteration bound " + iter + " must be at least 1"));
                continue;
            }
            if (criteria.containsKey(token)) {
                errors.add(ValidationError.structural("Section '" + token + "' is evaluated more than once (" + site + ")"));
                continue;
            }
            criteria.put(token, new EvaluationCriteria(th, iter));
        }
        return criteria;
    }

    /**
     * Parses {@code MEM_GRAPH} entries. {@code A -> [B, C]} means A depends on B and C;
     * a chain {@code A -> B -> C} means A depends on B and B depends on C.
     */
    public List<MemoryGraphEdge> parseGraph(List<ScannedBlock> blocks, List<ValidationError> errors,
                                            List<SymbolReference> references) {
        var edges = new ArrayList<MemoryGraphEdge>();

        for (var block : blocks) {
            String site = MEMORY_GRAPH + " at line " + block.line();
            for (var entry : EntrySplitter.split(block.body(), EntrySplitter.ENTRY_SEPARATORS)) {
                String[] parts = ARROW.split(entry.code(), -1);
                if (parts.length < 2) {
                    errors.add(ValidationError.structural("Malformed memory-graph entry '"
                            + SymbolTableBuilder.abbreviate(entry.code()) + "' in " + site));
                    continue;
                }
                var groups = new ArrayList<List<String>>();
                for (String part : parts) {
                    List<String> tokens = parseTokenGroup(part);
                    if (tokens == null) {
                        groups = null;
                        break;
                    }
                    groups.add(tokens);
                }
                if (groups == null || groups.get(0).isEmpty()) {
                    errors.add(ValidationError.structural("Malformed memory-graph entry '"
                            + SymbolTableBuilder.abbreviate(entry.code()) + "' in " + site));
                    continue;
                }
                for (var group : groups) {
                    for (String token : group) {
                        references.add(new SymbolReference(token, site));
                    }
                }
                for (int k = 0; k < groups.size() - 1; k++) {
                    for (String from : groups.get(k)) {
                        edges.add(new MemoryGraphEdge(from, groups.get(k + 1)));
                    }
                }
            }
        }
        return edges;
    }

    /**
     * {@code [A, B]} or a single token. Returns null when the text is neither.
     */
    private List<String> parseTokenGroup(String part) {
        String trimmed = part.trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            var tokens = new LinkedHashSet<String>();
            for (var item : EntrySplitter.split(trimmed.substring(1, trimmed.length() - 1),
                    EntrySplitter.ARGUMENT_SEPARATORS)) {
                String token = EntrySplitter.unquote(item.code());
                if (!TOKEN_PATTERN.matcher(token).matches()) {
                    return null;
                }
                tokens.add(token);
            }
            return List.copyOf(tokens);
        }
        String token = EntrySplitter.unquote(trimmed);
        return TOKEN_PATTERN.matcher(token).matches() ? List.of(token) : null;
    }

    private static Integer parseInteger(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void appendSentence(StringBuilder target, String text) {
        if (text.isBlank()) {
            return;
        }
        if (target.length() > 0) {
            target.append(' ');
        }
        target.append(text);
    }
}
