package com.omegaagi.core.graph;

import com.omegaagi.core.error.CyclicDependencyException;
import com.omegaagi.core.model.MemoryGraphEdge;
import com.omegaagi.core.model.ParsedScript;
import com.omegaagi.core.model.SectionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Computes a generation order from the memory graph using Kahn's algorithm.
 * <p>
 * An edge {@code A -> [B, C]} means A depends on B and C, so B and C come first.
 * Whenever several nodes are ready at once, the one declared earliest wins: sections
 * by their {@code WR_SECT} order, then graph-only symbols by their definition order.
 * Identical input therefore always yields the identical order.
 */
@Service
public class DependencyGraphResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphResolver.class);

    /**
     * Returns the section tokens in an order where every dependency precedes its dependents.
     *
     * @throws CyclicDependencyException if the graph has a cycle
     */
    public List<String> resolve(ParsedScript script) {
        return resolve(script.sections(), script.symbols().keySet(), script.edges());
    }

    public List<String> resolve(List<SectionDirective> sections, Set<String> symbolTokens,
                                List<MemoryGraphEdge> edges) {
        Map<String, Integer> rank = rankNodes(sections, symbolTokens, edges);

        // dependency -> dependents, and dependent -> number of distinct dependencies
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, Set<String>> dependencies = new HashMap<>();
        for (String node : rank.keySet()) {
            dependents.put(node, new LinkedHashSet<>());
            dependencies.put(node, new LinkedHashSet<>());
        }
        for (var edge : edges) {
            for (String dep : edge.to()) {
                dependencies.get(edge.from()).add(dep);
                dependents.get(dep).add(edge.from());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(rank::get));
        for (String node : rank.keySet()) {
            int degree = dependencies.get(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                ready.add(node);
            }
        }

        var order = new ArrayList<String>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : dependents.get(node)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < rank.size()) {
            var stuck = new HashSet<>(rank.keySet());
            order.forEach(stuck::remove);
            List<String> cycle = cycleMembers(stuck, dependents).stream()
                    .sorted(Comparator.comparing(rank::get))
                    .toList();
            log.warn("Memory graph has a cycle involving {}", cycle);
            throw new CyclicDependencyException(cycle);
        }

        var sectionTokens = new HashSet<String>();
        sections.forEach(s -> sectionTokens.add(s.symbol()));
        List<String> sectionOrder = order.stream().filter(sectionTokens::contains).toList();
        log.debug("Resolved generation order {}", sectionOrder);
        return sectionOrder;
    }

    /**
     * Every node that is a section or appears in an edge, ranked for tie-breaking.
     * Tokens outside the symbol table rank last, in order of first appearance.
     */
    private Map<String, Integer> rankNodes(List<SectionDirective> sections, Set<String> symbolTokens,
                                           List<MemoryGraphEdge> edges) {
        var graphTokens = new LinkedHashSet<String>();
        for (var edge : edges) {
            graphTokens.add(edge.from());
            graphTokens.addAll(edge.to());
        }

        Map<String, Integer> rank = new LinkedHashMap<>();
        for (var section : sections) {
            rank.putIfAbsent(section.symbol(), rank.size());
        }
        for (String token : symbolTokens) {
            if (graphTokens.contains(token)) {
                rank.putIfAbsent(token, rank.size());
            }
        }
        for (String token : graphTokens) {
            rank.putIfAbsent(token, rank.size());
        }
        return rank;
    }

    /**
     * Narrows the nodes Kahn's algorithm could not order down to those on (or between)
     * cycles, by repeatedly dropping nodes nothing else in the set depends on.
     */
    private Set<String> cycleMembers(Set<String> stuck, Map<String, Set<String>> dependents) {
        var remaining = new HashSet<>(stuck);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String node : List.copyOf(remaining)) {
                boolean hasDependentInSet = dependents.get(node).stream().anyMatch(remaining::contains);
                if (!hasDependentInSet) {
                    remaining.remove(node);
                    changed = true;
                }
            }
        }
        return remaining;
    }
}
