package com.omegaagi.core.model;

import java.util.List;

/**
 * One {@code MEM_GRAPH} entry: generating {@code from} depends on every token in {@code to}.
 *
 * @param from the dependent token
 * @param to   tokens that must be generated first, in declaration order without duplicates
 */
public record MemoryGraphEdge(
    String from,
    List<String> to
) {

    public MemoryGraphEdge {
        to = List.copyOf(to);
    }
}
