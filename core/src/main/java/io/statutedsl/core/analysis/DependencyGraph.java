package io.statutedsl.core.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over statute ids built from {@code REQUIRES} and {@code SUPERSEDES} edges.
 *
 * <p>Nodes and edges keep insertion order, so cycle reports are deterministic. Self-edges are
 * ignored here: a statute referring to itself is reported separately.
 */
public final class DependencyGraph {

    private enum Mark {
        WHITE,
        GREY,
        BLACK
    }

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    public void addNode(String id) {
        edges.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    /** Adds {@code from -> to}; both ends become nodes. Self-edges are dropped. */
    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        if (!from.equals(to)) {
            edges.get(from).add(to);
        }
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public Set<String> successors(String id) {
        Set<String> out = edges.get(id);
        return out == null ? Set.of() : Collections.unmodifiableSet(out);
    }

    /**
     * Finds cycles with a depth-first search that marks nodes in progress. Each cycle is
     * returned once, as the path of ids starting from the node where the search entered it
     * (the closing edge back to the first id is implied).
     */
    public List<List<String>> findCycles() {
        Map<String, Mark> marks = new HashMap<>();
        for (String node : edges.keySet()) {
            marks.put(node, Mark.WHITE);
        }
        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String node : edges.keySet()) {
            if (marks.get(node) == Mark.WHITE) {
                visit(node, marks, path, cycles, seen);
            }
        }
        return cycles;
    }

    private void visit(
            String node, Map<String, Mark> marks, List<String> path, List<List<String>> cycles, Set<Set<String>> seen) {
        marks.put(node, Mark.GREY);
        path.add(node);
        for (String next : edges.get(node)) {
            Mark mark = marks.get(next);
            if (mark == Mark.GREY) {
                List<String> cycle = List.copyOf(path.subList(path.indexOf(next), path.size()));
                if (seen.add(new HashSet<>(cycle))) {
                    cycles.add(cycle);
                }
            } else if (mark == Mark.WHITE) {
                visit(next, marks, path, cycles, seen);
            }
        }
        path.remove(path.size() - 1);
        marks.put(node, Mark.BLACK);
    }
}
