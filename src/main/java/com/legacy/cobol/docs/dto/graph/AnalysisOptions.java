package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Switches for one dependency graph analysis. Null fields fall back to the defaults
 * supplied by {@link #withDefaults(AnalysisOptions)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOptions {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_TRAVERSAL_STEPS = 1_000_000;

    private Boolean includeIndirectDependencies;
    private Integer maxDepth;
    private Boolean includeCopybooks;
    private Boolean includeJCL;
    private Boolean detectCircularDependencies;
    private Boolean calculateMetrics;
    private Integer maxNodes;   // 0 = unlimited
    private Integer maxEdges;   // 0 = unlimited
    private Integer maxTraversalSteps;   // 0 = unlimited

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder()
                .includeIndirectDependencies(true)
                .maxDepth(DEFAULT_MAX_DEPTH)
                .includeCopybooks(true)
                .includeJCL(true)
                .detectCircularDependencies(true)
                .calculateMetrics(true)
                .maxNodes(0)
                .maxEdges(0)
                .maxTraversalSteps(DEFAULT_MAX_TRAVERSAL_STEPS)
                .build();
    }

    /**
     * Returns a fully populated copy: every null field of this instance is taken from
     * {@code defaults}, and anything still null from {@link #defaults()}.
     */
    public AnalysisOptions withDefaults(AnalysisOptions defaults) {
        AnalysisOptions base = defaults != null ? defaults : defaults();
        AnalysisOptions builtIn = defaults();
        return AnalysisOptions.builder()
                .includeIndirectDependencies(pick(includeIndirectDependencies, base.includeIndirectDependencies, builtIn.includeIndirectDependencies))
                .maxDepth(pick(maxDepth, base.maxDepth, builtIn.maxDepth))
                .includeCopybooks(pick(includeCopybooks, base.includeCopybooks, builtIn.includeCopybooks))
                .includeJCL(pick(includeJCL, base.includeJCL, builtIn.includeJCL))
                .detectCircularDependencies(pick(detectCircularDependencies, base.detectCircularDependencies, builtIn.detectCircularDependencies))
                .calculateMetrics(pick(calculateMetrics, base.calculateMetrics, builtIn.calculateMetrics))
                .maxNodes(pick(maxNodes, base.maxNodes, builtIn.maxNodes))
                .maxEdges(pick(maxEdges, base.maxEdges, builtIn.maxEdges))
                .maxTraversalSteps(pick(maxTraversalSteps, base.maxTraversalSteps, builtIn.maxTraversalSteps))
                .build();
    }

    private static <T> T pick(T value, T fallback, T builtIn) {
        if (value != null) return value;
        return fallback != null ? fallback : builtIn;
    }
}
