package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.CriticalPath;
import com.legacy.cobol.docs.dto.graph.DependencyNode;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.dto.graph.RiskLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy heaviest-edge walks from every main program.
 */
final class CriticalPathIdentifier {

    static final int MIN_PATH_COMPLEXITY = 50;
    static final int BOTTLENECK_THRESHOLD = 5;

    List<CriticalPath> identify(GraphIndex index) {
        List<CriticalPath> paths = new ArrayList<>();
        for (int i = 0; i < index.nodeCount(); i++) {
            if (index.node(i).getType() != NodeType.MAIN) continue;
            CriticalPath path = walk(i, index);
            if (path != null && path.getTotalComplexity() > MIN_PATH_COMPLEXITY) {
                paths.add(path);
            }
        }

        // List.sort is stable: equal risk keeps main-node order
        paths.sort(Comparator.comparingInt((CriticalPath p) -> p.getRiskLevel().getRank()).reversed());
        for (int i = 0; i < paths.size(); i++) {
            paths.get(i).setId("critical-path-" + i);
        }

        for (CriticalPath path : paths) {
            for (String nodeId : path.getNodes()) {
                index.node(index.indexOf(nodeId)).setCritical(true);
            }
        }
        return paths;
    }

    /**
     * Follows the highest-weight outgoing edge (first one on ties) until a node repeats or has no
     * outgoing edge. The edge into a repeated node is still recorded. Returns null for one-node walks.
     */
    private CriticalPath walk(int start, GraphIndex index) {
        boolean[] visited = new boolean[index.nodeCount()];
        List<String> nodes = new ArrayList<>();
        List<String> edges = new ArrayList<>();
        int totalComplexity = 0;

        int current = start;
        while (!visited[current]) {
            visited[current] = true;
            DependencyNode node = index.node(current);
            nodes.add(node.getId());
            totalComplexity += node.getComplexity();

            int best = -1;
            for (int edge : index.outgoing(current)) {
                if (best < 0 || index.edge(edge).getWeight() > index.edge(best).getWeight()) {
                    best = edge;
                }
            }
            if (best < 0) break;
            edges.add(index.edge(best).getId());
            current = index.target(best);
        }

        if (nodes.size() <= 1) return null;

        return CriticalPath.builder()
                .nodes(nodes)
                .edges(edges)
                .totalComplexity(totalComplexity)
                .riskLevel(riskLevel(totalComplexity, nodes.size()))
                .bottlenecks(bottlenecks(nodes, index))
                .build();
    }

    private List<String> bottlenecks(List<String> nodes, GraphIndex index) {
        List<String> result = new ArrayList<>();
        for (String nodeId : nodes) {
            DependencyNode node = index.node(index.indexOf(nodeId));
            if (node.getDependencies().size() > BOTTLENECK_THRESHOLD
                    || node.getDependents().size() > BOTTLENECK_THRESHOLD) {
                result.add(nodeId);
            }
        }
        return result;
    }

    static RiskLevel riskLevel(int complexity, int pathLength) {
        int score = complexity + pathLength * 10;
        if (score > 200) return RiskLevel.CRITICAL;
        if (score > 100) return RiskLevel.HIGH;
        if (score > 50) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
