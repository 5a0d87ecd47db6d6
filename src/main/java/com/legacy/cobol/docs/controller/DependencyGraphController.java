package com.legacy.cobol.docs.controller;

import com.legacy.cobol.docs.dto.api.GraphAnalysisRequest;
import com.legacy.cobol.docs.dto.api.ShortestPathRequest;
import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyGraphResponse;
import com.legacy.cobol.docs.exception.PathNotFoundException;
import com.legacy.cobol.docs.service.graph.DependencyGraphAnalyzer;
import com.legacy.cobol.docs.service.graph.GraphQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for dependency graph analysis over caller-supplied program and dependency records.
 */
@RestController
@RequestMapping("/api/dependency-graph")
@RequiredArgsConstructor
@Slf4j
public class DependencyGraphController {

    private final DependencyGraphAnalyzer dependencyGraphAnalyzer;
    private final GraphQueryService graphQueryService;

    /**
     * Analyze a set of programs and dependencies.
     * Returns nodes, edges, cycles, critical paths and metrics.
     */
    @PostMapping("/analyze")
    public ResponseEntity<DependencyGraphResponse> analyze(@Valid @RequestBody GraphAnalysisRequest request) {
        log.info("Analyzing dependency graph: {} programs, {} dependencies",
                request.getPrograms().size(), request.getDependencies().size());

        DependencyGraph graph = dependencyGraphAnalyzer.analyze(
                request.getPrograms(), request.getDependencies(), request.getOptions());
        return ResponseEntity.ok(DependencyGraphResponse.from(graph));
    }

    /**
     * Fewest-hop route between two node ids, following edges in either direction.
     * Responds 404 when the nodes are not connected.
     */
    @PostMapping("/shortest-path")
    public ResponseEntity<List<String>> shortestPath(@Valid @RequestBody ShortestPathRequest request) {
        log.info("Finding shortest path from {} to {}", request.getFrom(), request.getTo());

        AnalysisOptions structureOnly = AnalysisOptions.builder()
                .includeIndirectDependencies(false)
                .detectCircularDependencies(false)
                .calculateMetrics(false)
                .build();
        DependencyGraph graph = dependencyGraphAnalyzer.analyze(
                request.getPrograms(), request.getDependencies(), structureOnly);

        List<String> path = graphQueryService.shortestPath(graph, request.getFrom(), request.getTo())
                .orElseThrow(() -> new PathNotFoundException(request.getFrom(), request.getTo()));
        return ResponseEntity.ok(path);
    }
}
