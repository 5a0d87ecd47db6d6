package com.legacy.cobol.docs.service;

import com.legacy.cobol.docs.dto.api.RepositoryAnalysisResponse;
import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.dto.graph.DependencyGraph;
import com.legacy.cobol.docs.dto.graph.DependencyGraphResponse;
import com.legacy.cobol.docs.dto.graph.EdgeType;
import com.legacy.cobol.docs.dto.graph.NodeType;
import com.legacy.cobol.docs.dto.parser.DependencyKind;
import com.legacy.cobol.docs.dto.parser.ParsedProgram;
import com.legacy.cobol.docs.dto.parser.ProcedureDivision;
import com.legacy.cobol.docs.dto.parser.ProgramDependency;
import com.legacy.cobol.docs.dto.parser.SourceMetrics;
import com.legacy.cobol.docs.exception.InvalidAnalysisRequestException;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import com.legacy.cobol.docs.service.graph.DependencyGraphAnalyzer;
import com.legacy.cobol.docs.service.parser.CobolParser;
import com.legacy.cobol.docs.service.parser.SourceMetricsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses every source of a repository, derives Program and Dependency records from the
 * results and analyzes the resulting dependency graph.
 *
 * <p>Sources are processed in file name order so program ids are stable for the same input.
 * CALL, COPY and INCLUDE targets are matched against PROGRAM-IDs first, then against file
 * base names, ignoring case. JCL members are not parsed as COBOL; their {@code EXEC PGM=}
 * steps become control-flow dependencies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RepositoryAnalysisService {

    private static final Pattern JCL_EXEC_PGM =
            Pattern.compile("\\bEXEC\\s+PGM=([A-Z0-9#@$\\-]+)", Pattern.CASE_INSENSITIVE);

    private final CobolParser cobolParser;
    private final SourceMetricsCalculator sourceMetricsCalculator;
    private final DependencyGraphAnalyzer dependencyGraphAnalyzer;

    public RepositoryAnalysisResponse analyze(Map<String, String> sources, AnalysisOptions options) {
        if (sources == null) {
            throw new InvalidAnalysisRequestException("sources must not be null");
        }
        log.info("[repo-analysis] begin files={}", sources.size());

        Map<String, String> ordered = new TreeMap<>(sources);
        ordered.forEach(cobolParser::requireWithinLimit);

        List<Program> programs = new ArrayList<>();
        Map<String, ParsedProgram> parseResults = new LinkedHashMap<>();
        Map<Long, List<Reference>> referencesByProgram = new LinkedHashMap<>();

        long nextProgramId = 1;
        for (Map.Entry<String, String> source : ordered.entrySet()) {
            String filename = source.getKey();
            Program program = isJcl(filename)
                    ? jclProgram(nextProgramId, filename, source.getValue(), referencesByProgram)
                    : cobolProgram(nextProgramId, filename, source.getValue(), parseResults, referencesByProgram);
            programs.add(program);
            nextProgramId++;
        }

        List<String> unresolved = new ArrayList<>();
        List<Dependency> dependencies = resolve(programs, referencesByProgram, unresolved);
        if (!unresolved.isEmpty()) {
            log.warn("[repo-analysis] {} dependency targets not found in the repository", unresolved.size());
        }

        DependencyGraph graph = dependencyGraphAnalyzer.analyze(programs, dependencies, options);
        log.info("[repo-analysis] done programs={} dependencies={} cycles={}",
                programs.size(), dependencies.size(), graph.getCycles().size());

        return RepositoryAnalysisResponse.builder()
                .programs(programs)
                .dependencies(dependencies)
                .parseResults(parseResults)
                .unresolvedTargets(unresolved)
                .graph(DependencyGraphResponse.from(graph))
                .build();
    }

    // ========================= PROGRAM RECORDS =========================

    private Program cobolProgram(long id, String filename, String text, Map<String, ParsedProgram> parseResults,
                                 Map<Long, List<Reference>> referencesByProgram) {
        ParsedProgram parsed = cobolParser.parse(text);
        SourceMetrics metrics = sourceMetricsCalculator.calculate(text);
        parseResults.put(filename, parsed);
        if (parsed.hasErrors()) {
            log.debug("[repo-analysis] {} parsed with {} errors", filename, parsed.getErrors().size());
        }

        List<Reference> references = new ArrayList<>();
        for (ProgramDependency dependency : parsed.getDependencies()) {
            references.add(new Reference(dependency.getType(), dependency.getTarget(),
                    dependency.getLine(), dependency.isCritical()));
        }
        referencesByProgram.put(id, references);

        String programId = parsed.getProgramIdOrUnknown();
        String author = parsed.getDivisions().getIdentification() != null
                ? parsed.getDivisions().getIdentification().getAuthor()
                : null;
        return Program.builder()
                .id(id)
                .name(ParsedProgram.UNKNOWN_PROGRAM_ID.equals(programId) ? baseName(filename) : programId)
                .filename(filename)
                .programType(programType(filename, parsed).getValue())
                .linesOfCode(metrics.getLinesOfCode())
                .complexity(metrics.getCyclomaticComplexity())
                .author(author)
                .build();
    }

    private Program jclProgram(long id, String filename, String text, Map<Long, List<Reference>> referencesByProgram) {
        List<Reference> references = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].startsWith("//*")) continue;
            Matcher matcher = JCL_EXEC_PGM.matcher(lines[i]);
            if (matcher.find()) {
                references.add(new Reference(null, matcher.group(1), i + 1, false));
            }
        }
        referencesByProgram.put(id, references);

        SourceMetrics metrics = sourceMetricsCalculator.calculate(text);
        return Program.builder()
                .id(id)
                .name(baseName(filename))
                .filename(filename)
                .programType(NodeType.JCL.getValue())
                .linesOfCode(metrics.getLinesOfCode())
                .complexity(1)
                .build();
    }

    static NodeType programType(String filename, ParsedProgram parsed) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jcl")) return NodeType.JCL;
        if (lower.endsWith(".cpy") || lower.endsWith(".copy")) return NodeType.COPYBOOK;
        ProcedureDivision procedure = parsed.getDivisions() == null ? null : parsed.getDivisions().getProcedure();
        if (procedure == null) return NodeType.COPYBOOK;
        if (procedure.getUsingClause() != null && !procedure.getUsingClause().isEmpty()) return NodeType.SUBROUTINE;
        return NodeType.MAIN;
    }

    // ========================= DEPENDENCY RECORDS =========================

    private List<Dependency> resolve(List<Program> programs, Map<Long, List<Reference>> referencesByProgram,
                                     List<String> unresolved) {
        Map<String, Long> byName = new HashMap<>();
        for (Program program : programs) {
            byName.putIfAbsent(baseName(program.getFilename()).toUpperCase(Locale.ROOT), program.getId());
        }
        // PROGRAM-ID wins over a file name
        for (Program program : programs) {
            byName.put(program.getName().toUpperCase(Locale.ROOT), program.getId());
        }

        Map<Long, String> filenames = new HashMap<>();
        programs.forEach(p -> filenames.put(p.getId(), p.getFilename()));

        List<Dependency> dependencies = new ArrayList<>();
        long nextDependencyId = 1;
        for (Map.Entry<Long, List<Reference>> entry : referencesByProgram.entrySet()) {
            for (Reference reference : entry.getValue()) {
                Long target = byName.get(reference.target().toUpperCase(Locale.ROOT));
                if (target == null) {
                    unresolved.add(filenames.get(entry.getKey()) + ": " + reference.describe());
                    continue;
                }
                if (target.equals(entry.getKey())) continue;
                dependencies.add(Dependency.builder()
                        .id(nextDependencyId++)
                        .fromProgramId(entry.getKey())
                        .toProgramId(target)
                        .dependencyType(reference.edgeType().getValue())
                        .lineNumber(reference.line())
                        .critical(reference.critical())
                        .build());
            }
        }
        return dependencies;
    }

    private static boolean isJcl(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(".jcl");
    }

    static String baseName(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** A reference found in one source; a null kind marks a JCL step. */
    private record Reference(DependencyKind kind, String target, int line, boolean critical) {

        EdgeType edgeType() {
            if (kind == null) return EdgeType.CONTROL_FLOW;
            return kind == DependencyKind.CALL ? EdgeType.CALL : EdgeType.COPY;
        }

        String describe() {
            return (kind == null ? "PGM" : kind.name()) + " " + target;
        }
    }
}
