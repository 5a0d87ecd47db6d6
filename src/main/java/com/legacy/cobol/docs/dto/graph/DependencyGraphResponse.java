package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat export of a {@link DependencyGraph} for API responses and UI rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyGraphResponse {

    private List<DependencyNode> nodes;
    private List<DependencyEdge> edges;
    private List<DependencyCycle> cycles;
    private List<CriticalPath> criticalPaths;
    private DependencyMetrics metrics;
    private int droppedDependencies;

    public static DependencyGraphResponse from(DependencyGraph graph) {
        return DependencyGraphResponse.builder()
                .nodes(new ArrayList<>(graph.getNodes().values()))
                .edges(new ArrayList<>(graph.getEdges().values()))
                .cycles(graph.getCycles())
                .criticalPaths(graph.getCriticalPaths())
                .metrics(graph.getMetrics())
                .droppedDependencies(graph.getDroppedDependencies())
                .build();
    }
}
