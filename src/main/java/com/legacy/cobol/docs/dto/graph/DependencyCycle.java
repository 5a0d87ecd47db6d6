package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A detected circular dependency. {@code nodes} holds the cycle once, without repeating
 * the first node at the end; {@code edges} includes the closing edge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyCycle {

    private String id;

    @Builder.Default
    private List<String> nodes = new ArrayList<>();

    @Builder.Default
    private List<String> edges = new ArrayList<>();

    private RiskLevel severity;
    private long impact;
    private String suggestion;
}
