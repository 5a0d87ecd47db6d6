package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.DependencyMetrics;
import com.legacy.cobol.docs.dto.graph.DependencyNode;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.exception.GraphLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Whole-graph metrics. Per-node figures use the node's {@code dependencies} list, which also
 * holds indirect dependencies when those were resolved.
 */
@Slf4j
final class DependencyMetricsCalculator {

    DependencyMetrics calculate(GraphIndex index, int maxDepth, int maxSteps) {
        int n = index.nodeCount();
        int totalDependencies = 0;
        double cohesion = 0;
        double instability = 0;
        int copybooks = 0;

        for (int i = 0; i < n; i++) {
            DependencyNode node = index.node(i);
            int efferent = node.getDependencies().size();
            int afferent = node.getDependents().size();
            totalDependencies += efferent;
            cohesion += efferent > 0 ? (double) node.getComplexity() / (node.getComplexity() + efferent) : 1.0;
            instability += efferent + afferent > 0 ? (double) efferent / (afferent + efferent) : 0.0;
            if (node.getType() == NodeType.COPYBOOK) copybooks++;
        }

        double average = n > 0 ? (double) totalDependencies / n : 0.0;
        return DependencyMetrics.builder()
                .totalNodes(n)
                .totalEdges(index.edgeCount())
                .averageDependencies(average)
                .maxDependencyDepth(maxDependencyDepth(index, maxDepth, maxSteps))
                .cyclomaticComplexity(index.edgeCount() - n + 2 * connectedComponents(index))
                .couplingIndex(average)
                .cohesionIndex(n > 0 ? cohesion / n : 0.0)
                .instabilityIndex(n > 0 ? instability / n : 0.0)
                .abstractnessIndex(n > 0 ? (double) copybooks / n : 0.0)
                .build();
    }

    /**
     * Longest outgoing chain, counted in nodes, from any main program. A node already on the
     * current chain ends it; chains are cut at {@code maxDepth} nodes. Every node entered counts
     * one step against {@code maxSteps} (0 means unlimited).
     */
    private int maxDependencyDepth(GraphIndex index, int maxDepth, int maxSteps) {
        if (maxDepth <= 0) return 0;
        int max = 0;
        long steps = 0;
        boolean[] onChain = new boolean[index.nodeCount()];
        // frame: node, next outgoing edge, nodes still allowed including this one, deepest child chain
        Deque<int[]> frames = new ArrayDeque<>();

        for (int i = 0; i < index.nodeCount(); i++) {
            if (index.node(i).getType() != NodeType.MAIN) continue;
            steps = step(steps, maxSteps);
            onChain[i] = true;
            frames.push(new int[]{i, 0, maxDepth, 0});

            while (!frames.isEmpty()) {
                int[] frame = frames.peek();
                List<Integer> outgoing = index.outgoing(frame[0]);
                if (frame[1] == outgoing.size()) {
                    frames.pop();
                    onChain[frame[0]] = false;
                    int chain = frame[3] + 1;
                    if (frames.isEmpty()) {
                        max = Math.max(max, chain);
                    } else {
                        frames.peek()[3] = Math.max(frames.peek()[3], chain);
                    }
                    continue;
                }

                int target = index.target(outgoing.get(frame[1]++));
                if (onChain[target] || frame[2] <= 1) continue;
                steps = step(steps, maxSteps);
                onChain[target] = true;
                frames.push(new int[]{target, 0, frame[2] - 1, 0});
            }
        }
        return max;
    }

    private long step(long steps, int maxSteps) {
        long next = steps + 1;
        if (maxSteps > 0 && next > maxSteps) {
            log.warn("[dependency-graph] max-depth walk stopped after {} steps", maxSteps);
            throw new GraphLimitExceededException("traversal step", (int) next, maxSteps);
        }
        return next;
    }

    /** Weakly connected components: edges are followed in both directions. */
    private int connectedComponents(GraphIndex index) {
        boolean[] seen = new boolean[index.nodeCount()];
        int components = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        for (int i = 0; i < index.nodeCount(); i++) {
            if (seen[i]) continue;
            components++;
            seen[i] = true;
            stack.push(i);
            while (!stack.isEmpty()) {
                int current = stack.pop();
                for (int edge : index.outgoing(current)) {
                    int next = index.target(edge);
                    if (!seen[next]) {
                        seen[next] = true;
                        stack.push(next);
                    }
                }
                for (int edge : index.incoming(current)) {
                    int next = index.source(edge);
                    if (!seen[next]) {
                        seen[next] = true;
                        stack.push(next);
                    }
                }
            }
        }
        return components;
    }
}
