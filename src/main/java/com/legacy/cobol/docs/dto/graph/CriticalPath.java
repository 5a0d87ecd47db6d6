package com.legacy.cobol.docs.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriticalPath {

    private String id;

    @Builder.Default
    private List<String> nodes = new ArrayList<>();

    @Builder.Default
    private List<String> edges = new ArrayList<>();

    private int totalComplexity;
    private RiskLevel riskLevel;

    @Builder.Default
    private List<String> bottlenecks = new ArrayList<>();
}
