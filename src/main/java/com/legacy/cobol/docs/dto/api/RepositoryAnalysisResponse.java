package com.legacy.cobol.docs.dto.api;

import com.legacy.cobol.docs.dto.graph.DependencyGraphResponse;
import com.legacy.cobol.docs.dto.parser.ParsedProgram;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryAnalysisResponse {
    @Builder.Default
    private List<Program> programs = new ArrayList<>();
    @Builder.Default
    private List<Dependency> dependencies = new ArrayList<>();
    @Builder.Default
    private Map<String, ParsedProgram> parseResults = new LinkedHashMap<>();   // by file name, COBOL sources only
    @Builder.Default
    private List<String> unresolvedTargets = new ArrayList<>();                // "<file>: <KIND> <target>"
    private DependencyGraphResponse graph;
}
