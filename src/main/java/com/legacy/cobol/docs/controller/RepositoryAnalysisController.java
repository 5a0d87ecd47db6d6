package com.legacy.cobol.docs.controller;

import com.legacy.cobol.docs.dto.api.RepositoryAnalysisRequest;
import com.legacy.cobol.docs.dto.api.RepositoryAnalysisResponse;
import com.legacy.cobol.docs.service.RepositoryAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/repositories")
@RequiredArgsConstructor
@Slf4j
public class RepositoryAnalysisController {

    private final RepositoryAnalysisService repositoryAnalysisService;

    /**
     * Parse all sources of a repository and analyze the dependencies between them.
     */
    @PostMapping("/analyze")
    public ResponseEntity<RepositoryAnalysisResponse> analyze(@Valid @RequestBody RepositoryAnalysisRequest request) {
        log.info("Analyzing repository sources: {} files", request.getSources().size());
        return ResponseEntity.ok(repositoryAnalysisService.analyze(request.getSources(), request.getOptions()));
    }
}
