package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.DependencyEdge;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer-indexed view of a built graph: nodes and edges in insertion order, with outgoing
 * and incoming edge lists per node. Built once after edges are created; passes that follow
 * only change flags and dependency lists, never the edge set.
 */
final class GraphIndex {

    private final List<DependencyNode> nodes;
    private final List<DependencyEdge> edges;
    private final Map<String, Integer> nodeIndex = new HashMap<>();
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final List<List<Integer>> outgoing;
    private final List<List<Integer>> incoming;

    private GraphIndex(DependencyGraph graph) {
        this.nodes = new ArrayList<>(graph.getNodes().values());
        this.edges = new ArrayList<>(graph.getEdges().values());
        this.outgoing = new ArrayList<>(nodes.size());
        this.incoming = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            nodeIndex.put(nodes.get(i).getId(), i);
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
        }

        this.edgeSource = new int[edges.size()];
        this.edgeTarget = new int[edges.size()];
        for (int e = 0; e < edges.size(); e++) {
            DependencyEdge edge = edges.get(e);
            edgeSource[e] = nodeIndex.get(edge.getSource());
            edgeTarget[e] = nodeIndex.get(edge.getTarget());
            outgoing.get(edgeSource[e]).add(e);
            incoming.get(edgeTarget[e]).add(e);
        }
    }

    static GraphIndex of(DependencyGraph graph) {
        return new GraphIndex(graph);
    }

    int nodeCount() {
        return nodes.size();
    }

    int edgeCount() {
        return edges.size();
    }

    DependencyNode node(int index) {
        return nodes.get(index);
    }

    DependencyEdge edge(int index) {
        return edges.get(index);
    }

    /** Index of the node with this id, or -1. */
    int indexOf(String nodeId) {
        Integer index = nodeIndex.get(nodeId);
        return index == null ? -1 : index;
    }

    int source(int edge) {
        return edgeSource[edge];
    }

    int target(int edge) {
        return edgeTarget[edge];
    }

    List<Integer> outgoing(int node) {
        return outgoing.get(node);
    }

    List<Integer> incoming(int node) {
        return incoming.get(node);
    }

    /** First edge, in edge order, from {@code source} to {@code target}; -1 when there is none. */
    int firstEdge(int source, int target) {
        for (int e : outgoing.get(source)) {
            if (edgeTarget[e] == target) return e;
        }
        return -1;
    }
}
