package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.DependencyCycle;
import com.legacy.cobol.docs.dto.graph.RiskLevel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds circular dependencies with a colored DFS over nodes and outgoing edges in insertion
 * order. A back edge into the current DFS stack yields the path from its target to the
 * current node as one cycle; rotations of a cycle already reported are skipped.
 */
final class CycleDetector {

    static final String TWO_NODE_SUGGESTION = "Consider breaking this circular dependency by introducing "
            + "an intermediate component or using dependency injection.";
    static final String SHORT_CYCLE_SUGGESTION = "This circular dependency can be resolved by refactoring "
            + "one of the components to depend on an abstraction instead of a concrete implementation.";
    static final String LONG_CYCLE_SUGGESTION = "This complex circular dependency requires architectural "
            + "refactoring. Consider breaking it into smaller, more cohesive modules.";

    List<DependencyCycle> detect(GraphIndex index) {
        int n = index.nodeCount();
        boolean[] visited = new boolean[n];
        boolean[] onStack = new boolean[n];
        List<Integer> path = new ArrayList<>();
        List<List<Integer>> cycles = new ArrayList<>();
        Set<String> reported = new HashSet<>();

        for (int i = 0; i < n; i++) {
            if (!visited[i]) {
                dfs(i, index, visited, onStack, path, cycles, reported);
            }
        }

        List<DependencyCycle> result = new ArrayList<>(cycles.size());
        for (List<Integer> cycle : cycles) {
            result.add(toCycle("cycle-" + result.size(), cycle, index));
        }
        return result;
    }

    /** Each frame holds a node and the cursor into its outgoing edges. */
    private void dfs(int start, GraphIndex index, boolean[] visited, boolean[] onStack, List<Integer> path,
                     List<List<Integer>> cycles, Set<String> reported) {
        Deque<int[]> frames = new ArrayDeque<>();
        enter(start, visited, onStack, path, frames);

        while (!frames.isEmpty()) {
            int[] frame = frames.peek();
            int node = frame[0];
            List<Integer> outgoing = index.outgoing(node);
            if (frame[1] == outgoing.size()) {
                frames.pop();
                onStack[node] = false;
                path.remove(path.size() - 1);
                continue;
            }

            int target = index.target(outgoing.get(frame[1]++));
            if (onStack[target]) {
                List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                if (reported.add(normalizeCycleKey(cycle))) {
                    cycles.add(cycle);
                }
            } else if (!visited[target]) {
                enter(target, visited, onStack, path, frames);
            }
        }
    }

    private void enter(int node, boolean[] visited, boolean[] onStack, List<Integer> path, Deque<int[]> frames) {
        visited[node] = true;
        onStack[node] = true;
        path.add(node);
        frames.push(new int[]{node, 0});
    }

    /**
     * Same key for every rotation of a cycle: the node list rotated to start at its smallest index.
     */
    private String normalizeCycleKey(List<Integer> cycle) {
        int minIdx = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i) < cycle.get(minIdx)) minIdx = i;
        }
        List<Integer> normalized = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            normalized.add(cycle.get((minIdx + i) % cycle.size()));
        }
        return normalized.toString();
    }

    private DependencyCycle toCycle(String id, List<Integer> cycle, GraphIndex index) {
        List<String> nodes = new ArrayList<>(cycle.size());
        List<Integer> edgeIndexes = new ArrayList<>(cycle.size());
        long complexity = 0;
        for (int i = 0; i < cycle.size(); i++) {
            int source = cycle.get(i);
            int edge = index.firstEdge(source, cycle.get((i + 1) % cycle.size()));
            nodes.add(index.node(source).getId());
            complexity += index.node(source).getComplexity();
            if (edge >= 0) {
                edgeIndexes.add(edge);
            }
        }

        DependencyCycle result = DependencyCycle.builder()
                .id(id)
                .nodes(nodes)
                .edges(edgeIndexes.stream().map(e -> index.edge(e).getId()).toList())
                .severity(severity(nodes.size(), complexity))
                .impact(new LinkedHashSet<>(nodes).size() * complexity)
                .suggestion(suggestion(nodes.size()))
                .build();

        for (int node : cycle) {
            index.node(node).setCircular(true);
        }
        for (int edge : edgeIndexes) {
            index.edge(edge).setCircular(true);
        }
        return result;
    }

    static RiskLevel severity(int length, long complexity) {
        if (length >= 5 || complexity > 100) return RiskLevel.CRITICAL;
        if (length >= 3 || complexity > 50) return RiskLevel.HIGH;
        if (length >= 2 || complexity > 20) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    static String suggestion(int length) {
        if (length == 2) return TWO_NODE_SUGGESTION;
        if (length <= 4) return SHORT_CYCLE_SUGGESTION;
        return LONG_CYCLE_SUGGESTION;
    }
}
