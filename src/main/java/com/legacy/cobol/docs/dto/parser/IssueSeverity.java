package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueSeverity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String value;

    IssueSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
