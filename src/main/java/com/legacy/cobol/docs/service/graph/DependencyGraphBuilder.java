package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.DependencyEdge;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyNode;
import com.legacy.cobol.docs.dto.graph.EdgeType;
import com.legacy.cobol.docs.dto.graph.NodeMetadata;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Creates nodes from programs and edges from dependency records.
 */
@Slf4j
final class DependencyGraphBuilder {

    private static final int BASE_WEIGHT = 1;
    private static final int CRITICAL_BONUS = 5;
    private static final int CIRCULAR_BONUS = 3;

    static String nodeId(Long programId) {
        return "program-" + programId;
    }

    static String edgeId(Long dependencyId) {
        return "edge-" + dependencyId;
    }

    static boolean isIncluded(Program program, AnalysisOptions options) {
        NodeType type = NodeType.fromProgramType(program.getProgramType());
        if (type == NodeType.COPYBOOK && !options.getIncludeCopybooks()) return false;
        return type != NodeType.JCL || options.getIncludeJCL();
    }

    DependencyGraph build(List<Program> programs, List<Dependency> dependencies, AnalysisOptions options) {
        DependencyGraph graph = new DependencyGraph();

        for (Program program : programs) {
            if (!isIncluded(program, options)) continue;
            DependencyNode node = DependencyNode.builder()
                    .id(nodeId(program.getId()))
                    .programId(program.getId())
                    .name(program.getName())
                    .type(NodeType.fromProgramType(program.getProgramType()))
                    .complexity(program.getComplexity())
                    .metadata(NodeMetadata.builder()
                            .linesOfCode(program.getLinesOfCode())
                            .lastModified(program.getUpdatedAt())
                            .author(program.getAuthor())
                            .build())
                    .build();
            graph.getNodes().put(node.getId(), node);
        }

        int dropped = 0;
        for (Dependency dependency : dependencies) {
            DependencyNode source = graph.getNodes().get(nodeId(dependency.getFromProgramId()));
            DependencyNode target = graph.getNodes().get(nodeId(dependency.getToProgramId()));
            if (source == null || target == null) {
                dropped++;
                log.debug("[dependency-graph] skipping dependency {}: {} -> {} not both present",
                        dependency.getId(), dependency.getFromProgramId(), dependency.getToProgramId());
                continue;
            }

            DependencyEdge edge = DependencyEdge.builder()
                    .id(edgeId(dependency.getId()))
                    .source(source.getId())
                    .target(target.getId())
                    .type(EdgeType.fromDependencyType(dependency.getDependencyType()))
                    .weight(weight(dependency))
                    .critical(dependency.isCritical())
                    .circular(dependency.isCircular())
                    .lineNumber(dependency.getLineNumber())
                    .build();
            graph.getEdges().put(edge.getId(), edge);

            source.getDependencies().add(target.getId());
            target.getDependents().add(source.getId());
        }

        if (dropped > 0) {
            log.warn("[dependency-graph] dropped {} of {} dependencies with a missing or excluded endpoint",
                    dropped, dependencies.size());
        }
        graph.setDroppedDependencies(dropped);
        return graph;
    }

    /**
     * 1, plus 5 when critical, plus 3 when circular, plus the edge type bonus. An unrecognized
     * raw type becomes a CALL edge but earns no type bonus.
     */
    static int weight(Dependency dependency) {
        int weight = BASE_WEIGHT;
        if (dependency.isCritical()) weight += CRITICAL_BONUS;
        if (dependency.isCircular()) weight += CIRCULAR_BONUS;
        Optional<EdgeType> type = EdgeType.parse(dependency.getDependencyType());
        return weight + type.map(EdgeType::getWeightBonus).orElse(0);
    }
}
