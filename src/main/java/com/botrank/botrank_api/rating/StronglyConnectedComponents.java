package com.botrank.botrank_api.rating;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strongly connected components of a directed graph given as an edge list.
 *
 * Two-pass Kosaraju without recursion, so pools of any size are safe:
 *   Pass 1: postorder of the forward graph using an explicit work list of
 *           (node, finished) items.
 *   Pass 2: walk the transpose graph in reverse postorder, labelling every
 *           node reachable through in-neighbours with the same root.
 *
 * Nodes only exist as edge endpoints. Iteration follows first-seen order,
 * so root labels are stable for a given edge list, but callers should only
 * rely on the partition (which nodes share a root), never on the label.
 */
public final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    public record Edge<T>(T source, T destination) {}

    private record Visit<T>(T node, boolean finished) {}

    /**
     * @return mapping of every node to the root of its component; two nodes
     *         share a root if and only if each is reachable from the other
     */
    public static <T> Map<T, T> analyze(Iterable<Edge<T>> edges) {
        Map<T, Set<T>> outNeighbors = new LinkedHashMap<>();
        Map<T, Set<T>> inNeighbors = new LinkedHashMap<>();
        Set<T> nodes = new LinkedHashSet<>();

        for (Edge<T> edge : edges) {
            nodes.add(edge.source());
            nodes.add(edge.destination());
            outNeighbors.computeIfAbsent(edge.source(), k -> new LinkedHashSet<>()).add(edge.destination());
            inNeighbors.computeIfAbsent(edge.destination(), k -> new LinkedHashSet<>()).add(edge.source());
        }

        List<T> finishing = postorder(nodes, outNeighbors);
        return assignRoots(finishing, inNeighbors);
    }

    /** Number of distinct roots in a mapping produced by {@link #analyze}. */
    public static <T> int countComponents(Map<T, T> roots) {
        return new HashSet<>(roots.values()).size();
    }

    // =========================================================================
    // Pass 1: forward postorder
    // =========================================================================

    private static <T> List<T> postorder(Set<T> nodes, Map<T, Set<T>> outNeighbors) {
        Set<T> visited = new HashSet<>();
        List<T> finishing = new ArrayList<>(nodes.size());
        Deque<Visit<T>> work = new ArrayDeque<>();

        for (T node : nodes) {
            work.push(new Visit<>(node, false));
        }

        while (!work.isEmpty()) {
            Visit<T> visit = work.pop();
            T node = visit.node();
            if (visit.finished()) {
                finishing.add(node);
                continue;
            }
            if (!visited.add(node)) {
                continue;
            }
            // Re-push as finished below the neighbours so it pops after them
            work.push(new Visit<>(node, true));
            for (T neighbor : outNeighbors.getOrDefault(node, Collections.emptySet())) {
                if (!visited.contains(neighbor)) {
                    work.push(new Visit<>(neighbor, false));
                }
            }
        }
        return finishing;
    }

    // =========================================================================
    // Pass 2: transpose walk in reverse postorder
    // =========================================================================

    private static <T> Map<T, T> assignRoots(List<T> finishing, Map<T, Set<T>> inNeighbors) {
        Map<T, T> roots = new HashMap<>();
        Deque<T> pending = new ArrayDeque<>();

        for (int i = finishing.size() - 1; i >= 0; i--) {
            T root = finishing.get(i);
            if (roots.containsKey(root)) {
                continue;
            }
            pending.push(root);
            while (!pending.isEmpty()) {
                T node = pending.pop();
                if (roots.containsKey(node)) {
                    continue;
                }
                roots.put(node, root);
                for (T predecessor : inNeighbors.getOrDefault(node, Collections.emptySet())) {
                    if (!roots.containsKey(predecessor)) {
                        pending.push(predecessor);
                    }
                }
            }
        }
        return roots;
    }
}
