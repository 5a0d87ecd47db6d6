package com.legacy.cobol.docs.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of program a dependency graph node stands for.
 */
public enum NodeType {
    MAIN("main"),
    SUBROUTINE("subroutine"),
    COPYBOOK("copybook"),
    JCL("jcl");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps a stored program type, case-insensitive. Unknown or missing types are subroutines.
     */
    public static NodeType fromProgramType(String programType) {
        if (programType == null) return SUBROUTINE;
        switch (programType.trim().toLowerCase(Locale.ROOT)) {
            case "main": return MAIN;
            case "copybook": return COPYBOOK;
            case "jcl": return JCL;
            default: return SUBROUTINE;
        }
    }
}
