package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.DependencyNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extends every node's {@code dependencies} with the nodes it reaches transitively within
 * {@code maxDepth} hops. Runs breadth-first over the direct edges with an explicit queue.
 * A node that reaches itself through a cycle lists its own id; it is not expanded again.
 */
final class IndirectDependencyResolver {

    void resolve(GraphIndex index, int maxDepth) {
        // Computed for every node before any list changes so results do not leak between nodes.
        List<Set<String>> reachable = new ArrayList<>(index.nodeCount());
        for (int i = 0; i < index.nodeCount(); i++) {
            reachable.add(reachableFrom(index, i, maxDepth));
        }

        for (int i = 0; i < index.nodeCount(); i++) {
            DependencyNode node = index.node(i);
            Set<String> existing = new LinkedHashSet<>(node.getDependencies());
            for (String id : reachable.get(i)) {
                if (existing.add(id)) {
                    node.getDependencies().add(id);
                }
            }
        }
    }

    private Set<String> reachableFrom(GraphIndex index, int start, int maxDepth) {
        Set<String> result = new LinkedHashSet<>();
        int[] depth = new int[index.nodeCount()];
        Arrays.fill(depth, -1);
        depth[start] = 0;

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (depth[current] >= maxDepth) continue;
            for (int edge : index.outgoing(current)) {
                int target = index.target(edge);
                if (target == start) {
                    result.add(index.node(start).getId());
                    continue;
                }
                if (depth[target] >= 0) continue;
                depth[target] = depth[current] + 1;
                result.add(index.node(target).getId());
                queue.add(target);
            }
        }
        return result;
    }
}
