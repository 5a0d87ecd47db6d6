package com.legacy.cobol.docs.config;

import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default {@link AnalysisOptions} for dependency graph analysis, loaded from the
 * {@code cobol.analysis} namespace. Request options override these field by field.
 */
@ConfigurationProperties(prefix = "cobol.analysis")
@Data
public class AnalysisProperties {

    private boolean includeIndirectDependencies = true;
    private int maxDepth = 10;
    private boolean includeCopybooks = true;
    private boolean includeJcl = true;
    private boolean detectCircularDependencies = true;
    private boolean calculateMetrics = true;

    /** Node ceiling for one analysis; 0 disables the check. */
    private int maxNodes = 0;

    /** Edge ceiling for one analysis; 0 disables the check. */
    private int maxEdges = 0;

    /** Step budget for the max-depth walk; 0 disables the check. */
    private int maxTraversalSteps = AnalysisOptions.DEFAULT_MAX_TRAVERSAL_STEPS;

    public AnalysisOptions toOptions() {
        return AnalysisOptions.builder()
                .includeIndirectDependencies(includeIndirectDependencies)
                .maxDepth(maxDepth)
                .includeCopybooks(includeCopybooks)
                .includeJCL(includeJcl)
                .detectCircularDependencies(detectCircularDependencies)
                .calculateMetrics(calculateMetrics)
                .maxNodes(maxNodes)
                .maxEdges(maxEdges)
                .maxTraversalSteps(maxTraversalSteps)
                .build();
    }
}
