package com.legacy.cobol.docs.service;

import com.legacy.cobol.docs.config.AnalysisProperties;
import com.legacy.cobol.docs.config.ParserProperties;
import com.legacy.cobol.docs.dto.api.RepositoryAnalysisResponse;
import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.exception.InvalidAnalysisRequestException;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import com.legacy.cobol.docs.service.graph.DependencyGraphAnalyzer;
import com.legacy.cobol.docs.service.parser.CobolParser;
import com.legacy.cobol.docs.service.parser.KeywordCriticalityClassifier;
import com.legacy.cobol.docs.service.parser.SourceMetricsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepositoryAnalysisServiceTest {

    @Mock
    private DependencyGraphAnalyzer dependencyGraphAnalyzer;

    @Captor
    private ArgumentCaptor<List<Program>> programsCaptor;

    @Captor
    private ArgumentCaptor<List<Dependency>> dependenciesCaptor;

    private RepositoryAnalysisService repositoryAnalysisService;

    @BeforeEach
    void setUp() {
        ParserProperties parserProperties = new ParserProperties();
        repositoryAnalysisService = new RepositoryAnalysisService(
                new CobolParser(parserProperties, new KeywordCriticalityClassifier()),
                new SourceMetricsCalculator(parserProperties),
                dependencyGraphAnalyzer);
    }

    private static String sample(String name) {
        try (InputStream in = RepositoryAnalysisServiceTest.class.getResourceAsStream("/samples/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static Map<String, String> repository() {
        Map<String, String> sources = new HashMap<>();
        for (String name : List.of("PAYROLL.cbl", "CALCTAX.cbl", "AUDITLOG.cbl", "PAYCONST.cpy", "NIGHTLY.jcl")) {
            sources.put(name, sample(name));
        }
        return sources;
    }

    @Test
    void derivesProgramsInFileNameOrder() {
        when(dependencyGraphAnalyzer.analyze(anyList(), anyList(), any())).thenReturn(new DependencyGraph());

        RepositoryAnalysisResponse response = repositoryAnalysisService.analyze(repository(), null);

        assertThat(response.getPrograms())
                .extracting(Program::getId, Program::getName, Program::getProgramType)
                .containsExactly(
                        tuple(1L, "AUDITLOG", "subroutine"),
                        tuple(2L, "CALCTAX", "subroutine"),
                        tuple(3L, "NIGHTLY", "jcl"),
                        tuple(4L, "PAYCONST", "copybook"),
                        tuple(5L, "PAYROLL", "main"));

        Program payroll = response.getPrograms().get(4);
        assertThat(payroll.getFilename()).isEqualTo("PAYROLL.cbl");
        assertThat(payroll.getLinesOfCode()).isEqualTo(50);
        assertThat(payroll.getComplexity()).isEqualTo(2);
        assertThat(payroll.getAuthor()).isEqualTo("JANE SMITH");
        assertThat(response.getPrograms().get(2).getComplexity()).isEqualTo(1);
    }

    @Test
    void resolvesCallsCopiesAndJobSteps() {
        when(dependencyGraphAnalyzer.analyze(anyList(), anyList(), any())).thenReturn(new DependencyGraph());

        RepositoryAnalysisResponse response = repositoryAnalysisService.analyze(repository(), null);

        assertThat(response.getDependencies())
                .extracting(Dependency::getId, Dependency::getFromProgramId, Dependency::getToProgramId,
                        Dependency::getDependencyType, Dependency::getLineNumber)
                .containsExactly(
                        tuple(1L, 2L, 1L, "call", 10),
                        tuple(2L, 3L, 5L, "control_flow", 3),
                        tuple(3L, 5L, 4L, "copy", 32),
                        tuple(4L, 5L, 2L, "call", 46),
                        tuple(5L, 5L, 1L, "call", 50));
        assertThat(response.getUnresolvedTargets()).containsExactly("NIGHTLY.jcl: PGM IEFBR14");
    }

    @Test
    void passesDerivedRecordsAndOptionsToAnalyzer() {
        AnalysisOptions options = AnalysisOptions.builder().includeJCL(false).build();
        when(dependencyGraphAnalyzer.analyze(anyList(), anyList(), any())).thenReturn(new DependencyGraph());

        RepositoryAnalysisResponse response = repositoryAnalysisService.analyze(repository(), options);

        verify(dependencyGraphAnalyzer).analyze(programsCaptor.capture(), dependenciesCaptor.capture(),
                eq(options));
        assertThat(programsCaptor.getValue()).isEqualTo(response.getPrograms());
        assertThat(dependenciesCaptor.getValue()).hasSize(5);
        assertThat(response.getGraph()).isNotNull();
    }

    @Test
    void keepsParseResultsForCobolSourcesOnly() {
        when(dependencyGraphAnalyzer.analyze(anyList(), anyList(), any())).thenReturn(new DependencyGraph());

        RepositoryAnalysisResponse response = repositoryAnalysisService.analyze(repository(), null);

        assertThat(response.getParseResults().keySet())
                .containsExactly("AUDITLOG.cbl", "CALCTAX.cbl", "PAYCONST.cpy", "PAYROLL.cbl");
        assertThat(response.getParseResults().get("PAYROLL.cbl").getDependencies()).hasSize(3);
        assertThat(response.getParseResults().get("PAYCONST.cpy").hasErrors()).isTrue();
    }

    @Test
    void matchesTargetsByFileName_whenProgramIdDiffers() {
        when(dependencyGraphAnalyzer.analyze(anyList(), anyList(), any())).thenReturn(new DependencyGraph());
        Map<String, String> sources = Map.of(
                "src/driver.cbl", String.join("\n",
                        "       IDENTIFICATION DIVISION.",
                        "       PROGRAM-ID. DRIVER.",
                        "       PROCEDURE DIVISION.",
                        "       MAIN-PARA.",
                        "           CALL 'helper' *> required",
                        "           CALL 'DRIVER'",
                        "           GOBACK."),
                "src/helper.cbl", String.join("\n",
                        "       IDENTIFICATION DIVISION.",
                        "       PROGRAM-ID. HLPR01.",
                        "       PROCEDURE DIVISION USING WS-IN.",
                        "       MAIN-PARA.",
                        "           GOBACK."));

        RepositoryAnalysisResponse response = repositoryAnalysisService.analyze(sources, null);

        assertThat(response.getPrograms()).extracting(Program::getName).containsExactly("DRIVER", "HLPR01");
        assertThat(response.getDependencies())
                .extracting(Dependency::getFromProgramId, Dependency::getToProgramId, Dependency::isCritical)
                .containsExactly(tuple(1L, 2L, true));
        assertThat(response.getUnresolvedTargets()).isEmpty();
    }

    @Test
    void producesGraphWithRealAnalyzer() {
        RepositoryAnalysisService service = new RepositoryAnalysisService(
                new CobolParser(new ParserProperties(), new KeywordCriticalityClassifier()),
                new SourceMetricsCalculator(new ParserProperties()),
                new DependencyGraphAnalyzer(new AnalysisProperties()));

        RepositoryAnalysisResponse response = service.analyze(repository(), null);

        assertThat(response.getGraph().getNodes()).hasSize(5);
        assertThat(response.getGraph().getEdges()).hasSize(5);
        assertThat(response.getGraph().getCycles()).isEmpty();
        assertThat(response.getGraph().getNodes())
                .filteredOn(node -> node.getType() == NodeType.JCL)
                .singleElement()
                .satisfies(node -> assertThat(node.getDependencies())
                        .containsExactly("program-5", "program-4", "program-2", "program-1"));
    }

    @Test
    void rejectsMissingSources() {
        assertThatThrownBy(() -> repositoryAnalysisService.analyze(null, null))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        verifyNoInteractions(dependencyGraphAnalyzer);
    }

    @Test
    void rejectsOversizedSourceBeforeParsing() {
        ParserProperties small = new ParserProperties();
        small.setMaxSourceBytes(100);
        RepositoryAnalysisService limited = new RepositoryAnalysisService(
                new CobolParser(small, new KeywordCriticalityClassifier()),
                new SourceMetricsCalculator(small),
                dependencyGraphAnalyzer);

        assertThatThrownBy(() -> limited.analyze(repository(), null))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("bytes");
        verifyNoInteractions(dependencyGraphAnalyzer);
    }

    @Test
    void classifiesProgramTypeAndBaseName() {
        assertThat(RepositoryAnalysisService.baseName("src/cobol/PAYROLL.cbl")).isEqualTo("PAYROLL");
        assertThat(RepositoryAnalysisService.baseName("lib\\COPYREC.cpy")).isEqualTo("COPYREC");
        assertThat(RepositoryAnalysisService.baseName("NOEXT")).isEqualTo("NOEXT");
        assertThat(RepositoryAnalysisService.programType("x.JCL", null)).isEqualTo(NodeType.JCL);
    }
}
