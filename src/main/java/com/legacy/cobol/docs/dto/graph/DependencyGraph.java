package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one dependency analysis. Node and edge maps keep insertion order so repeated
 * analyses of the same input produce identical output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyGraph {

    @Builder.Default
    private Map<String, DependencyNode> nodes = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, DependencyEdge> edges = new LinkedHashMap<>();

    @Builder.Default
    private List<DependencyCycle> cycles = new ArrayList<>();

    @Builder.Default
    private List<CriticalPath> criticalPaths = new ArrayList<>();

    @Builder.Default
    private DependencyMetrics metrics = DependencyMetrics.empty();

    // Dependency records skipped because an endpoint program was missing or filtered out
    private int droppedDependencies;
}
