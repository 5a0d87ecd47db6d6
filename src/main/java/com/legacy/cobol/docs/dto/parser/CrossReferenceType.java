package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrossReferenceType {
    VARIABLE("variable"),
    PROCEDURE("procedure"),
    FILE("file"),
    COPYBOOK("copybook");

    private final String value;

    CrossReferenceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
