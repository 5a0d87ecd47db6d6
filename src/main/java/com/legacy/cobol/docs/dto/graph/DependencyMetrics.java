package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate metrics over a whole dependency graph. All zero when the metrics pass is skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyMetrics {

    private int totalNodes;
    private int totalEdges;
    private double averageDependencies;
    private int maxDependencyDepth;
    private int cyclomaticComplexity;   // E - N + 2P over the inter-program graph
    private double couplingIndex;
    private double cohesionIndex;
    private double instabilityIndex;
    private double abstractnessIndex;

    public static DependencyMetrics empty() {
        return new DependencyMetrics();
    }
}
