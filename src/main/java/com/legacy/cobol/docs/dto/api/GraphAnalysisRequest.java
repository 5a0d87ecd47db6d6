package com.legacy.cobol.docs.dto.api;

import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Programs and dependency records of one scope (repository or project) to analyze together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphAnalysisRequest {
    @NotNull
    @Valid
    private List<Program> programs;
    @NotNull
    @Valid
    private List<Dependency> dependencies;
    private AnalysisOptions options;   // optional, overrides configured defaults field by field
}
