package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.config.ParserProperties;
import com.legacy.cobol.docs.dto.parser.CrossReference;
import com.legacy.cobol.docs.dto.parser.Divisions;
import com.legacy.cobol.docs.dto.parser.ParseIssue;
import com.legacy.cobol.docs.dto.parser.ParsedProgram;
import com.legacy.cobol.docs.dto.parser.ProgramDependency;
import com.legacy.cobol.docs.exception.InvalidAnalysisRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Line-oriented structural parser for one COBOL source text.
 *
 * <p>Divisions are read in order (IDENTIFICATION, ENVIRONMENT, DATA, PROCEDURE), then the whole
 * text is scanned for CALL/COPY/INCLUDE dependencies and cross references. Problems in the
 * source are reported as errors and warnings on the result; {@link #parse(String)} itself
 * does not throw. Instances hold no per-parse state and can be shared.
 */
@Service
@Slf4j
public class CobolParser {

    private final ParserProperties properties;
    private final DivisionParser divisionParser;
    private final DataDivisionParser dataDivisionParser;
    private final ProcedureDivisionParser procedureDivisionParser;
    private final DependencyExtractor dependencyExtractor;
    private final CrossReferenceBuilder crossReferenceBuilder;

    public CobolParser(ParserProperties properties, DependencyCriticalityClassifier criticalityClassifier) {
        this.properties = properties;
        this.divisionParser = new DivisionParser();
        this.dataDivisionParser = new DataDivisionParser();
        this.procedureDivisionParser = new ProcedureDivisionParser(properties.getAreaBColumn());
        this.dependencyExtractor = new DependencyExtractor(criticalityClassifier);
        this.crossReferenceBuilder = new CrossReferenceBuilder();
    }

    public ParsedProgram parse(String source) {
        SourceLines lines = SourceLines.of(source);
        ParseContext context = new ParseContext();
        log.debug("[cobol-parser] parsing {} lines", lines.size());

        Divisions.DivisionsBuilder divisions = Divisions.builder();
        List<ProgramDependency> dependencies = List.of();
        List<CrossReference> crossReferences = List.of();
        try {
            divisions.identification(divisionParser.parseIdentification(lines, context));
            divisions.environment(divisionParser.parseEnvironment(lines, context));
            divisions.data(dataDivisionParser.parse(lines, context));
            divisions.procedure(procedureDivisionParser.parse(lines, context));
            dependencies = dependencyExtractor.extract(lines);
            crossReferences = crossReferenceBuilder.build(lines, divisions.build(), dependencies);
        } catch (RuntimeException e) {
            log.error("[cobol-parser] unexpected failure near line {}", context.cursor() + 1, e);
            context.error(context.cursor() + 1, 0, "Parse error: " + e.getMessage(), ParseIssue.PARSE_ERROR);
        }

        ParsedProgram program = ParsedProgram.builder()
                .divisions(divisions.build())
                .errors(context.errors())
                .warnings(context.warnings())
                .dependencies(dependencies)
                .crossReferences(crossReferences)
                .build();
        log.debug("[cobol-parser] parsed {}: {} errors, {} warnings, {} dependencies",
                program.getProgramIdOrUnknown(), program.getErrors().size(),
                program.getWarnings().size(), dependencies.size());
        return program;
    }

    /**
     * Rejects a source text larger than {@code cobol.parser.max-source-bytes}.
     */
    public void requireWithinLimit(String name, String source) {
        if (source == null) {
            throw new InvalidAnalysisRequestException("Source text is required: " + name);
        }
        long size = source.getBytes(StandardCharsets.UTF_8).length;
        if (size > properties.getMaxSourceBytes()) {
            throw new InvalidAnalysisRequestException(String.format(
                    "Source %s is %d bytes, limit is %d", name, size, properties.getMaxSourceBytes()));
        }
    }
}
