package com.legacy.cobol.docs.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyEdge {

    private String id;          // edge-<dependencyId>
    private String source;      // Source node ID
    private String target;      // Target node ID
    private EdgeType type;
    private int weight;

    @JsonProperty("isCritical")
    private boolean critical;

    @JsonProperty("isCircular")
    private boolean circular;

    private Integer lineNumber;
}
