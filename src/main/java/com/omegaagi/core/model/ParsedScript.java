package com.omegaagi.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The immutable, parsed form of one script: preamble directives, the symbol table,
 * memory-graph edges and section directives in declaration order.
 */
public record ParsedScript(
    RawScript source,
    List<String> preamble,
    Map<String, Symbol> symbols,
    List<MemoryGraphEdge> edges,
    List<SectionDirective> sections
) {

    public ParsedScript {
        preamble = List.copyOf(preamble);
        symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        edges = List.copyOf(edges);
        sections = List.copyOf(sections);
    }

    public Optional<SectionDirective> section(String token) {
        return sections.stream().filter(s -> s.symbol().equals(token)).findFirst();
    }

    /**
     * Direct dependencies of {@code token}, merged across all edges that name it as
     * their source, in first-seen order.
     */
    public List<String> dependenciesOf(String token) {
        var deps = new LinkedHashSet<String>();
        for (var edge : edges) {
            if (edge.from().equals(token)) {
                deps.addAll(edge.to());
            }
        }
        return List.copyOf(deps);
    }
}
