package com.legacy.cobol.docs.controller;

import com.legacy.cobol.docs.dto.api.ParseRequest;
import com.legacy.cobol.docs.dto.api.SourceMetricsRequest;
import com.legacy.cobol.docs.dto.parser.ParsedProgram;
import com.legacy.cobol.docs.dto.parser.SourceMetrics;
import com.legacy.cobol.docs.service.parser.CobolParser;
import com.legacy.cobol.docs.service.parser.DataItemHierarchyBuilder;
import com.legacy.cobol.docs.service.parser.SourceMetricsCalculator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for single-source parsing and source metrics.
 */
@RestController
@RequestMapping("/api/cobol")
@RequiredArgsConstructor
@Slf4j
public class CobolParserController {

    private final CobolParser cobolParser;
    private final DataItemHierarchyBuilder dataItemHierarchyBuilder;
    private final SourceMetricsCalculator sourceMetricsCalculator;

    /**
     * Parse one COBOL source into its structural view.
     * Data items are returned flat unless {@code nestDataItems} is true.
     */
    @PostMapping("/parse")
    public ResponseEntity<ParsedProgram> parse(@Valid @RequestBody ParseRequest request) {
        log.info("Parsing COBOL source: {} chars, nestDataItems: {}",
                request.getSource().length(), request.getNestDataItems());
        cobolParser.requireWithinLimit("request", request.getSource());

        ParsedProgram program = cobolParser.parse(request.getSource());
        if (Boolean.TRUE.equals(request.getNestDataItems())) {
            program = dataItemHierarchyBuilder.nest(program);
        }
        return ResponseEntity.ok(program);
    }

    @PostMapping("/metrics")
    public ResponseEntity<SourceMetrics> metrics(@Valid @RequestBody SourceMetricsRequest request) {
        log.info("Calculating source metrics: {} chars", request.getSource().length());
        cobolParser.requireWithinLimit("request", request.getSource());
        return ResponseEntity.ok(sourceMetricsCalculator.calculate(request.getSource()));
    }
}
