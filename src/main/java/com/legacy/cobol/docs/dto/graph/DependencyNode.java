package com.legacy.cobol.docs.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One program in the dependency graph.
 * {@code dependencies} lists outgoing node ids (direct first, then indirect when resolved),
 * {@code dependents} lists incoming node ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyNode {

    private String id;              // program-<programId>
    private Long programId;
    private String name;
    private NodeType type;
    private int complexity;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    @Builder.Default
    private List<String> dependents = new ArrayList<>();

    @JsonProperty("isCritical")
    private boolean critical;

    @JsonProperty("isCircular")
    private boolean circular;

    private NodeMetadata metadata;
}
