package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionType {
    SIMPLE("simple");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
