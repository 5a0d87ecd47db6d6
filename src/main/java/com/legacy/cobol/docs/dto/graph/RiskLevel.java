package com.legacy.cobol.docs.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered risk scale shared by cycle severity and critical path risk.
 */
public enum RiskLevel {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int rank;

    RiskLevel(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }
}
