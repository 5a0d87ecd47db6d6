package com.legacy.cobol.docs.dto.api;

import com.legacy.cobol.docs.dto.graph.AnalysisOptions;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Source files of one repository keyed by file name (a relative path is fine).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryAnalysisRequest {
    @NotNull
    private Map<String, String> sources;
    private AnalysisOptions options;
}
