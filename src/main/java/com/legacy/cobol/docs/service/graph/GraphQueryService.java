package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.DependencyEdge;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyNode;
import com.legacy.cobol.docs.dto.graph.NodeType;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only lookups over an analyzed graph.
 */
@Service
public class GraphQueryService {

    public List<DependencyNode> nodesByType(DependencyGraph graph, NodeType type) {
        return graph.getNodes().values().stream()
                .filter(node -> node.getType() == type)
                .collect(Collectors.toList());
    }

    public List<DependencyNode> criticalNodes(DependencyGraph graph) {
        return graph.getNodes().values().stream()
                .filter(DependencyNode::isCritical)
                .collect(Collectors.toList());
    }

    public List<DependencyNode> circularNodes(DependencyGraph graph) {
        return graph.getNodes().values().stream()
                .filter(DependencyNode::isCircular)
                .collect(Collectors.toList());
    }

    /**
     * Fewest-hop route between two nodes, following edges in either direction.
     *
     * @return node ids from {@code fromId} to {@code toId}, or empty when either id is unknown
     *         or the nodes are not connected
     */
    public Optional<List<String>> shortestPath(DependencyGraph graph, String fromId, String toId) {
        if (!graph.getNodes().containsKey(fromId) || !graph.getNodes().containsKey(toId)) {
            return Optional.empty();
        }
        if (fromId.equals(toId)) {
            return Optional.of(List.of(fromId));
        }

        Map<String, List<String>> neighbours = new LinkedHashMap<>();
        for (DependencyEdge edge : graph.getEdges().values()) {
            neighbours.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
            neighbours.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge.getSource());
        }

        Map<String, String> previous = new HashMap<>();
        previous.put(fromId, null);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(fromId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : neighbours.getOrDefault(current, List.of())) {
                if (previous.containsKey(next)) continue;
                previous.put(next, current);
                if (next.equals(toId)) {
                    return Optional.of(reconstruct(previous, toId));
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    private List<String> reconstruct(Map<String, String> previous, String toId) {
        List<String> path = new ArrayList<>();
        for (String current = toId; current != null; current = previous.get(current)) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}
