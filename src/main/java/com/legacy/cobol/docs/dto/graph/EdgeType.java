package com.legacy.cobol.docs.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Relationship carried by a dependency graph edge, with the weight bonus it contributes.
 */
public enum EdgeType {
    CALL("call", 2),
    COPY("copy", 1),
    DATA_FLOW("data_flow", 3),
    CONTROL_FLOW("control_flow", 4);

    private final String value;
    private final int weightBonus;

    EdgeType(String value, int weightBonus) {
        this.value = value;
        this.weightBonus = weightBonus;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeightBonus() {
        return weightBonus;
    }

    public static Optional<EdgeType> parse(String dependencyType) {
        if (dependencyType == null) return Optional.empty();
        String normalized = dependencyType.trim().toLowerCase(Locale.ROOT);
        for (EdgeType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a stored dependency type; unknown types are treated as calls.
     */
    public static EdgeType fromDependencyType(String dependencyType) {
        return parse(dependencyType).orElse(CALL);
    }
}
