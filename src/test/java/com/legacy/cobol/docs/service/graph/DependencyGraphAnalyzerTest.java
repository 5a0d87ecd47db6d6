package com.legacy.cobol.docs.service.graph;

import com.legacy.cobol.docs.config.AnalysisProperties;
import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.CriticalPath;
import com.legacy.cobol.docs.dto.graph.DependencyCycle;
import com.legacy.cobol.docs.dto.graph.DependencyEdge;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyMetrics;
import com.legacy.cobol.docs.dto.graph.DependencyNode;
import com.legacy.cobol.docs.dto.graph.EdgeType;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.dto.graph.RiskLevel;
import com.legacy.cobol.docs.exception.GraphLimitExceededException;
import com.legacy.cobol.docs.exception.InvalidAnalysisRequestException;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DependencyGraphAnalyzerTest {

    private DependencyGraphAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DependencyGraphAnalyzer(new AnalysisProperties());
    }

    static Program program(long id, String name, String type, int complexity) {
        return Program.builder()
                .id(id)
                .name(name)
                .filename(name + ".cbl")
                .programType(type)
                .complexity(complexity)
                .linesOfCode(complexity * 10)
                .build();
    }

    static Dependency dependency(long id, long from, long to, String type) {
        return Dependency.builder()
                .id(id)
                .fromProgramId(from)
                .toProgramId(to)
                .dependencyType(type)
                .lineNumber((int) id * 10)
                .build();
    }

    private static AnalysisOptions.AnalysisOptionsBuilder options() {
        return AnalysisOptions.builder();
    }

    // ========================= BUILD =========================

    @Test
    void buildsNodesAndEdges_withDirectDependencyLists() {
        DependencyGraph graph = analyzer.analyze(
                List.of(program(1, "A", "main", 10), program(2, "B", "subroutine", 5)),
                List.of(dependency(7, 1, 2, "call")),
                options().includeIndirectDependencies(false).build());

        DependencyNode a = graph.getNodes().get("program-1");
        assertThat(a.getName()).isEqualTo("A");
        assertThat(a.getType()).isEqualTo(NodeType.MAIN);
        assertThat(a.getDependencies()).containsExactly("program-2");
        assertThat(a.getMetadata().getLinesOfCode()).isEqualTo(100);
        assertThat(graph.getNodes().get("program-2").getDependents()).containsExactly("program-1");

        DependencyEdge edge = graph.getEdges().get("edge-7");
        assertThat(edge.getSource()).isEqualTo("program-1");
        assertThat(edge.getTarget()).isEqualTo("program-2");
        assertThat(edge.getType()).isEqualTo(EdgeType.CALL);
        assertThat(edge.getLineNumber()).isEqualTo(70);
        assertThat(graph.getDroppedDependencies()).isZero();
    }

    @Test
    void dropsDependencyWithMissingEndpoint() {
        DependencyGraph graph = analyzer.analyze(
                List.of(program(1, "A", "main", 10), program(2, "B", "subroutine", 5)),
                List.of(dependency(1, 1, 2, "call"), dependency(2, 1, 99, "call")));

        assertThat(graph.getEdges()).containsOnlyKeys("edge-1");
        assertThat(graph.getDroppedDependencies()).isEqualTo(1);
        assertThat(graph.getNodes().get("program-1").getDependencies()).containsExactly("program-2");
    }

    @Test
    void excludesCopybooksAndJcl_whenDisabled() {
        List<Program> programs = List.of(
                program(1, "MAINPGM", "main", 10),
                program(2, "COPYREC", "copybook", 1),
                program(3, "NIGHTLY", "jcl", 1));
        List<Dependency> dependencies = List.of(
                dependency(1, 1, 2, "copy"),
                dependency(2, 3, 1, "control_flow"));

        DependencyGraph graph = analyzer.analyze(programs, dependencies,
                options().includeCopybooks(false).includeJCL(false).build());

        assertThat(graph.getNodes()).containsOnlyKeys("program-1");
        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getDroppedDependencies()).isEqualTo(2);
    }

    @Test
    void weighsEdgesByFlagsAndType() {
        List<Program> programs = List.of(program(1, "A", "main", 1), program(2, "B", "subroutine", 1));
        Dependency critical = dependency(1, 1, 2, "call");
        critical.setCritical(true);
        Dependency circular = dependency(6, 1, 2, "call");
        circular.setCircular(true);
        List<Dependency> dependencies = List.of(
                critical,
                dependency(2, 1, 2, "copy"),
                dependency(3, 1, 2, "data_flow"),
                dependency(4, 1, 2, "control_flow"),
                dependency(5, 1, 2, "something-else"),
                circular);

        DependencyGraph graph = analyzer.analyze(programs, dependencies,
                options().detectCircularDependencies(false).build());

        assertThat(graph.getEdges().values()).extracting(DependencyEdge::getWeight)
                .containsExactly(8, 2, 4, 5, 1, 6);
        assertThat(graph.getEdges().get("edge-5").getType()).isEqualTo(EdgeType.CALL);
        assertThat(graph.getEdges().get("edge-1").isCritical()).isTrue();
    }

    // ========================= INDIRECT =========================

    @Test
    void appendsIndirectDependenciesAfterDirectOnes() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies());

        assertThat(graph.getNodes().get("program-1").getDependencies())
                .containsExactly("program-2", "program-3", "program-4");
        assertThat(graph.getNodes().get("program-3").getDependencies()).containsExactly("program-4");
        assertThat(graph.getNodes().get("program-4").getDependencies()).isEmpty();
    }

    @Test
    void limitsIndirectDependenciesByMaxDepth() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies(), options().maxDepth(2).build());

        assertThat(graph.getNodes().get("program-1").getDependencies())
                .containsExactly("program-2", "program-3");
    }

    @Test
    void listsNodeOnCycleAsItsOwnIndirectDependency() {
        DependencyGraph graph = analyzer.analyze(threeCycle(), threeCycleDependencies());

        assertThat(graph.getNodes().get("program-1").getDependencies())
                .containsExactly("program-2", "program-3", "program-1");
        assertThat(graph.getNodes().get("program-2").getDependencies())
                .containsExactly("program-3", "program-1", "program-2");
        assertThat(graph.getNodes().values())
                .allSatisfy(node -> assertThat(node.getDependencies()).doesNotHaveDuplicates());
        assertThat(graph.getMetrics().getAverageDependencies()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void omitsOwnIdWhenCycleIsLongerThanMaxDepth() {
        DependencyGraph graph = analyzer.analyze(threeCycle(), threeCycleDependencies(),
                options().maxDepth(2).build());

        assertThat(graph.getNodes().get("program-1").getDependencies())
                .containsExactly("program-2", "program-3");
    }

    @Test
    void neverListsNodeOutsideCycleAsItsOwnDependency() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies());

        for (DependencyNode node : graph.getNodes().values()) {
            assertThat(node.getDependencies()).doesNotContain(node.getId());
        }
    }

    // ========================= CYCLES =========================

    @Test
    void reportsThreeNodeCycleOnce() {
        DependencyGraph graph = analyzer.analyze(threeCycle(), threeCycleDependencies());

        assertThat(graph.getCycles()).hasSize(1);
        DependencyCycle cycle = graph.getCycles().get(0);
        assertThat(cycle.getId()).isEqualTo("cycle-0");
        assertThat(cycle.getNodes()).containsExactly("program-1", "program-2", "program-3");
        assertThat(cycle.getEdges()).containsExactly("edge-1", "edge-2", "edge-3");
        assertThat(cycle.getSeverity()).isEqualTo(RiskLevel.HIGH);
        assertThat(cycle.getImpact()).isEqualTo(90);
        assertThat(cycle.getSuggestion()).isEqualTo(CycleDetector.SHORT_CYCLE_SUGGESTION);
        assertThat(graph.getNodes().values()).allMatch(DependencyNode::isCircular);
        assertThat(graph.getEdges().values()).allMatch(DependencyEdge::isCircular);
    }

    @Test
    void reportsNoCycles_forAcyclicGraph() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies());

        assertThat(graph.getCycles()).isEmpty();
        assertThat(graph.getNodes().values()).noneMatch(DependencyNode::isCircular);
        assertThat(graph.getEdges().values()).noneMatch(DependencyEdge::isCircular);
    }

    @Test
    void reportsMutualCallsAsTwoNodeCycle() {
        DependencyGraph graph = analyzer.analyze(
                List.of(program(1, "A", "subroutine", 5), program(2, "B", "subroutine", 5),
                        program(3, "C", "subroutine", 5)),
                List.of(dependency(1, 1, 2, "call"), dependency(2, 2, 1, "call"), dependency(3, 2, 3, "call")));

        assertThat(graph.getCycles()).hasSize(1);
        assertThat(graph.getCycles().get(0).getSeverity()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(graph.getCycles().get(0).getSuggestion()).isEqualTo(CycleDetector.TWO_NODE_SUGGESTION);
        assertThat(graph.getNodes().get("program-3").isCircular()).isFalse();
        assertThat(graph.getEdges().get("edge-3").isCircular()).isFalse();
    }

    @Test
    void skipsCycleDetection_whenDisabled() {
        DependencyGraph graph = analyzer.analyze(threeCycle(), threeCycleDependencies(),
                options().detectCircularDependencies(false).build());

        assertThat(graph.getCycles()).isEmpty();
        assertThat(graph.getNodes().values()).noneMatch(DependencyNode::isCircular);
    }

    @Test
    void detectsCycleClosingTenThousandProgramChain() {
        int size = 10_000;
        List<Program> programs = new ArrayList<>();
        List<Dependency> dependencies = new ArrayList<>();
        for (long id = 1; id <= size; id++) {
            programs.add(program(id, "PGM" + id, id == 1 ? "main" : "subroutine", 1));
            dependencies.add(dependency(id, id, id == size ? 1 : id + 1, "call"));
        }

        DependencyGraph graph = analyzer.analyze(programs, dependencies,
                options().includeIndirectDependencies(false).maxDepth(size * 2).build());

        assertThat(graph.getCycles()).hasSize(1);
        DependencyCycle cycle = graph.getCycles().get(0);
        assertThat(cycle.getNodes()).hasSize(size).startsWith("program-1").endsWith("program-" + size);
        assertThat(cycle.getEdges()).hasSize(size);
        assertThat(cycle.getSeverity()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(graph.getMetrics().getMaxDependencyDepth()).isEqualTo(size);
    }

    @Test
    void gradesCycleSeverityBySizeAndComplexity() {
        assertThat(CycleDetector.severity(5, 10)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(CycleDetector.severity(2, 101)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(CycleDetector.severity(2, 51)).isEqualTo(RiskLevel.HIGH);
        assertThat(CycleDetector.severity(1, 21)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(CycleDetector.severity(1, 5)).isEqualTo(RiskLevel.LOW);
        assertThat(CycleDetector.suggestion(6)).isEqualTo(CycleDetector.LONG_CYCLE_SUGGESTION);
    }

    // ========================= CRITICAL PATHS =========================

    @Test
    void followsHeaviestEdgesFromMainPrograms() {
        List<Program> programs = List.of(
                program(1, "MAINPGM", "main", 30),
                program(2, "POSTING", "subroutine", 20),
                program(3, "LEDGER", "subroutine", 15),
                program(4, "CONSTS", "copybook", 40));
        Dependency heavy = dependency(2, 1, 2, "call");
        heavy.setCritical(true);
        List<Dependency> dependencies = List.of(
                dependency(1, 1, 4, "copy"),
                heavy,
                dependency(3, 2, 3, "call"));

        DependencyGraph graph = analyzer.analyze(programs, dependencies);

        assertThat(graph.getCriticalPaths()).hasSize(1);
        CriticalPath path = graph.getCriticalPaths().get(0);
        assertThat(path.getId()).isEqualTo("critical-path-0");
        assertThat(path.getNodes()).containsExactly("program-1", "program-2", "program-3");
        assertThat(path.getEdges()).containsExactly("edge-2", "edge-3");
        assertThat(path.getTotalComplexity()).isEqualTo(65);
        assertThat(path.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(path.getBottlenecks()).isEmpty();
        assertThat(graph.getNodes().get("program-2").isCritical()).isTrue();
        assertThat(graph.getNodes().get("program-4").isCritical()).isFalse();
    }

    @Test
    void ignoresLowComplexityPaths() {
        DependencyGraph graph = analyzer.analyze(threeCycle(), threeCycleDependencies());

        assertThat(graph.getCriticalPaths()).isEmpty();
        assertThat(graph.getNodes().values()).noneMatch(DependencyNode::isCritical);
    }

    @Test
    void flagsBottlenecksOnPath() {
        List<Program> programs = new ArrayList<>();
        programs.add(program(1, "MAINPGM", "main", 40));
        programs.add(program(2, "HUB", "subroutine", 20));
        List<Dependency> dependencies = new ArrayList<>();
        dependencies.add(dependency(1, 1, 2, "control_flow"));
        for (long id = 3; id <= 8; id++) {
            programs.add(program(id, "LEAF" + id, "subroutine", 1));
            dependencies.add(dependency(id, 2, id, "call"));
        }

        DependencyGraph graph = analyzer.analyze(programs, dependencies,
                options().includeIndirectDependencies(false).build());

        CriticalPath path = graph.getCriticalPaths().get(0);
        assertThat(path.getNodes()).containsExactly("program-1", "program-2", "program-3");
        assertThat(path.getBottlenecks()).containsExactly("program-2");
    }

    @Test
    void gradesPathRisk() {
        assertThat(CriticalPathIdentifier.riskLevel(190, 2)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(CriticalPathIdentifier.riskLevel(81, 2)).isEqualTo(RiskLevel.HIGH);
        assertThat(CriticalPathIdentifier.riskLevel(31, 2)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(CriticalPathIdentifier.riskLevel(30, 2)).isEqualTo(RiskLevel.LOW);
    }

    // ========================= METRICS =========================

    @Test
    void averagesDirectDependencies() {
        DependencyGraph graph = analyzer.analyze(
                List.of(program(1, "A", "main", 1), program(2, "B", "subroutine", 1),
                        program(3, "C", "subroutine", 1)),
                List.of(dependency(1, 1, 2, "call")));

        DependencyMetrics metrics = graph.getMetrics();
        assertThat(metrics.getTotalNodes()).isEqualTo(3);
        assertThat(metrics.getTotalEdges()).isEqualTo(1);
        assertThat(metrics.getAverageDependencies()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(metrics.getCouplingIndex()).isEqualTo(metrics.getAverageDependencies());
        assertThat(metrics.getCyclomaticComplexity()).isEqualTo(1 - 3 + 2 * 2);
    }

    @Test
    void computesChainMetrics() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies());

        DependencyMetrics metrics = graph.getMetrics();
        assertThat(metrics.getAverageDependencies()).isCloseTo(6.0 / 4, within(1e-9));
        assertThat(metrics.getMaxDependencyDepth()).isEqualTo(4);
        assertThat(metrics.getCyclomaticComplexity()).isEqualTo(1);
        assertThat(metrics.getAbstractnessIndex()).isCloseTo(0.25, within(1e-9));
        // instability per node: 3/3, 2/3, 1/2, 0/1
        assertThat(metrics.getInstabilityIndex()).isCloseTo((1.0 + 2.0 / 3 + 0.5) / 4, within(1e-9));
        // cohesion per node: 10/(10+3), 8/(8+2), 6/(6+1), no dependencies 1
        assertThat(metrics.getCohesionIndex())
                .isCloseTo((10.0 / 13 + 8.0 / 10 + 6.0 / 7 + 1.0) / 4, within(1e-9));
    }

    @Test
    void capsDependencyDepthAtMaxDepth() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies(), options().maxDepth(2).build());

        assertThat(graph.getMetrics().getMaxDependencyDepth()).isEqualTo(2);
    }

    @Test
    void leavesMetricsEmpty_whenDisabledByConfiguration() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setCalculateMetrics(false);
        DependencyGraphAnalyzer configured = new DependencyGraphAnalyzer(properties);

        DependencyGraph graph = configured.analyze(chain(), chainDependencies());

        assertThat(graph.getMetrics()).isEqualTo(DependencyMetrics.empty());
    }

    @Test
    void handlesEmptyInput() {
        DependencyGraph graph = analyzer.analyze(List.of(), List.of());

        assertThat(graph.getNodes()).isEmpty();
        assertThat(graph.getMetrics().getTotalNodes()).isZero();
        assertThat(graph.getMetrics().getAverageDependencies()).isZero();
    }

    // ========================= OPTIONS AND LIMITS =========================

    @Test
    void requestOptionsOverrideConfiguredDefaults() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setMaxDepth(3);
        properties.setIncludeCopybooks(false);
        DependencyGraphAnalyzer configured = new DependencyGraphAnalyzer(properties);

        AnalysisOptions resolved = configured.resolveOptions(options().includeCopybooks(true).build());

        assertThat(resolved.getMaxDepth()).isEqualTo(3);
        assertThat(resolved.getIncludeCopybooks()).isTrue();
        assertThat(resolved.getIncludeJCL()).isTrue();
    }

    @Test
    void rejectsGraphsOverNodeLimit() {
        assertThatThrownBy(() -> analyzer.analyze(chain(), chainDependencies(), options().maxNodes(3).build()))
                .isInstanceOfSatisfying(GraphLimitExceededException.class, e -> {
                    assertThat(e.getLimit()).isEqualTo("node");
                    assertThat(e.getActual()).isEqualTo(4);
                    assertThat(e.getMaximum()).isEqualTo(3);
                });
    }

    @Test
    void rejectsGraphsOverEdgeLimit() {
        assertThatThrownBy(() -> analyzer.analyze(chain(), chainDependencies(), options().maxEdges(2).build()))
                .isInstanceOf(GraphLimitExceededException.class)
                .hasMessage("Graph edge limit exceeded: 3 > 2");
    }

    @Test
    void stopsMaxDepthWalkAtTraversalBudget() {
        int size = 9;
        List<Program> programs = new ArrayList<>();
        List<Dependency> dependencies = new ArrayList<>();
        long nextId = 1;
        for (long from = 1; from <= size; from++) {
            programs.add(program(from, "PGM" + from, "main", 1));
            for (long to = 1; to <= size; to++) {
                if (from != to) dependencies.add(dependency(nextId++, from, to, "call"));
            }
        }

        assertThatThrownBy(() -> analyzer.analyze(programs, dependencies, options()
                .includeIndirectDependencies(false)
                .detectCircularDependencies(false)
                .maxTraversalSteps(1000)
                .build()))
                .isInstanceOfSatisfying(GraphLimitExceededException.class, e -> {
                    assertThat(e.getLimit()).isEqualTo("traversal step");
                    assertThat(e.getActual()).isEqualTo(1001);
                    assertThat(e.getMaximum()).isEqualTo(1000);
                });
    }

    @Test
    void countsOneTraversalStepPerNodeEntered() {
        DependencyGraph graph = analyzer.analyze(chain(), chainDependencies(),
                options().maxTraversalSteps(4).build());
        assertThat(graph.getMetrics().getMaxDependencyDepth()).isEqualTo(4);

        assertThatThrownBy(() -> analyzer.analyze(chain(), chainDependencies(), options().maxTraversalSteps(3).build()))
                .isInstanceOf(GraphLimitExceededException.class)
                .hasMessage("Graph traversal step limit exceeded: 4 > 3");
    }

    @Test
    void rejectsDuplicateDependencyIds() {
        List<Dependency> dependencies = List.of(
                dependency(7, 1, 2, "call"),
                dependency(7, 2, 3, "call"),
                dependency(8, 3, 1, "call"));

        assertThatThrownBy(() -> analyzer.analyze(threeCycle(), dependencies))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessage("duplicate dependency id: 7");
    }

    @Test
    void rejectsDuplicateProgramIds() {
        List<Program> programs = List.of(program(1, "A", "main", 1), program(1, "B", "subroutine", 1));

        assertThatThrownBy(() -> analyzer.analyze(programs, List.of()))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessage("duplicate program id: 1");
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> analyzer.analyze(null, List.of()))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> analyzer.analyze(List.of(Program.builder().name("NOID").build()), List.of()))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> analyzer.analyze(chain(), Arrays.asList(dependency(1, 1, 2, "call"), null)))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> analyzer.analyze(chain(), chainDependencies(), options().maxDepth(-1).build()))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> analyzer.analyze(chain(), chainDependencies(), options().maxTraversalSteps(-1).build()))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("maxTraversalSteps");
    }

    @Test
    void producesIdenticalResultsForIdenticalInput() {
        DependencyGraph first = analyzer.analyze(threeCycle(), threeCycleDependencies());
        DependencyGraph second = analyzer.analyze(threeCycle(), threeCycleDependencies());

        assertThat(second).isEqualTo(first);
        assertThat(second.getNodes().keySet()).containsExactlyElementsOf(first.getNodes().keySet());
        assertThat(second.getEdges().keySet()).containsExactlyElementsOf(first.getEdges().keySet());
    }

    // ========================= FIXTURES =========================

    /** MAINPGM -> VALIDATE -> FORMAT -> CUSTREC (copybook). */
    private static List<Program> chain() {
        return List.of(
                program(1, "MAINPGM", "main", 10),
                program(2, "VALIDATE", "subroutine", 8),
                program(3, "FORMAT", "subroutine", 6),
                program(4, "CUSTREC", "copybook", 1));
    }

    private static List<Dependency> chainDependencies() {
        return List.of(
                dependency(1, 1, 2, "call"),
                dependency(2, 2, 3, "call"),
                dependency(3, 3, 4, "copy"));
    }

    private static List<Program> threeCycle() {
        return List.of(
                program(1, "A", "main", 10),
                program(2, "B", "subroutine", 10),
                program(3, "C", "subroutine", 10));
    }

    private static List<Dependency> threeCycleDependencies() {
        return List.of(
                dependency(1, 1, 2, "call"),
                dependency(2, 2, 3, "call"),
                dependency(3, 3, 1, "call"));
    }
}
