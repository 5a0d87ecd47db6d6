package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.config.AnalysisProperties;
import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.exception.GraphLimitExceededException;
import com.legacy.cobol.docs.exception.InvalidAnalysisRequestException;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds and analyzes the cross-program dependency graph.
 *
 * <p>Pipeline: build nodes and edges, then optionally resolve indirect dependencies, detect
 * cycles, identify critical paths (always) and compute metrics. Every call works on a fresh
 * graph, so one instance can serve concurrent requests.
 */
@Service
@Slf4j
public class DependencyGraphAnalyzer {

    private final AnalysisProperties analysisProperties;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final IndirectDependencyResolver indirectDependencyResolver = new IndirectDependencyResolver();
    private final CycleDetector cycleDetector = new CycleDetector();
    private final CriticalPathIdentifier criticalPathIdentifier = new CriticalPathIdentifier();
    private final DependencyMetricsCalculator metricsCalculator = new DependencyMetricsCalculator();

    public DependencyGraphAnalyzer(AnalysisProperties analysisProperties) {
        this.analysisProperties = analysisProperties;
    }

    public DependencyGraph analyze(List<Program> programs, List<Dependency> dependencies) {
        return analyze(programs, dependencies, null);
    }

    public DependencyGraph analyze(List<Program> programs, List<Dependency> dependencies, AnalysisOptions requested) {
        AnalysisOptions options = resolveOptions(requested);
        validate(programs, dependencies, options);
        log.info("[dependency-graph] analyze programs={} dependencies={} indirect={} cycles={} metrics={}",
                programs.size(), dependencies.size(), options.getIncludeIndirectDependencies(),
                options.getDetectCircularDependencies(), options.getCalculateMetrics());

        DependencyGraph graph = graphBuilder.build(programs, dependencies, options);
        GraphIndex index = GraphIndex.of(graph);
        log.debug("[dependency-graph] built {} nodes, {} edges", index.nodeCount(), index.edgeCount());

        if (options.getIncludeIndirectDependencies()) {
            indirectDependencyResolver.resolve(index, options.getMaxDepth());
        }

        if (options.getDetectCircularDependencies()) {
            graph.setCycles(cycleDetector.detect(index));
            log.debug("[dependency-graph] {} cycles", graph.getCycles().size());
        }

        graph.setCriticalPaths(criticalPathIdentifier.identify(index));

        if (options.getCalculateMetrics()) {
            graph.setMetrics(metricsCalculator.calculate(index, options.getMaxDepth(), options.getMaxTraversalSteps()));
        }

        log.info("[dependency-graph] done nodes={} edges={} cycles={} criticalPaths={} dropped={}",
                graph.getNodes().size(), graph.getEdges().size(), graph.getCycles().size(),
                graph.getCriticalPaths().size(), graph.getDroppedDependencies());
        return graph;
    }

    AnalysisOptions resolveOptions(AnalysisOptions requested) {
        AnalysisOptions defaults = analysisProperties.toOptions();
        return requested == null ? defaults.withDefaults(null) : requested.withDefaults(defaults);
    }

    private void validate(List<Program> programs, List<Dependency> dependencies, AnalysisOptions options) {
        if (programs == null) {
            throw new InvalidAnalysisRequestException("programs must not be null");
        }
        if (dependencies == null) {
            throw new InvalidAnalysisRequestException("dependencies must not be null");
        }
        if (programs.stream().anyMatch(p -> p == null || p.getId() == null)) {
            throw new InvalidAnalysisRequestException("every program needs an id");
        }
        if (dependencies.stream().anyMatch(Objects::isNull)) {
            throw new InvalidAnalysisRequestException("dependencies must not contain null entries");
        }
        requireUniqueIds("program", programs.stream().map(Program::getId).toList());
        requireUniqueIds("dependency", dependencies.stream().map(Dependency::getId).toList());
        if (options.getMaxDepth() < 0) {
            throw new InvalidAnalysisRequestException("maxDepth must not be negative: " + options.getMaxDepth());
        }
        if (options.getMaxNodes() < 0 || options.getMaxEdges() < 0 || options.getMaxTraversalSteps() < 0) {
            throw new InvalidAnalysisRequestException("maxNodes, maxEdges and maxTraversalSteps must not be negative");
        }

        int nodeCount = (int) programs.stream().filter(p -> DependencyGraphBuilder.isIncluded(p, options)).count();
        if (options.getMaxNodes() > 0 && nodeCount > options.getMaxNodes()) {
            log.warn("[dependency-graph] {} nodes exceed limit {}", nodeCount, options.getMaxNodes());
            throw new GraphLimitExceededException("node", nodeCount, options.getMaxNodes());
        }
        if (options.getMaxEdges() > 0 && dependencies.size() > options.getMaxEdges()) {
            log.warn("[dependency-graph] {} dependencies exceed limit {}", dependencies.size(), options.getMaxEdges());
            throw new GraphLimitExceededException("edge", dependencies.size(), options.getMaxEdges());
        }
    }

    /** Node and edge ids derive from these ids; a repeat would overwrite an entry. */
    private static void requireUniqueIds(String kind, List<Long> ids) {
        Set<Long> seen = new HashSet<>();
        for (Long id : ids) {
            if (!seen.add(id)) {
                throw new InvalidAnalysisRequestException("duplicate " + kind + " id: " + id);
            }
        }
    }
}
