package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

/**
 * A diagnostic recorded while parsing. Lines are 1-based; 0 means "no specific line".
 */
@Value
@Builder
public class ParseIssue {

    public static final String MISSING_DIVISION = "MISSING_DIVISION";
    public static final String MISSING_PROGRAM_ID = "MISSING_PROGRAM_ID";
    public static final String DUPLICATE_PARAGRAPH = "DUPLICATE_PARAGRAPH";
    public static final String PARSE_ERROR = "PARSE_ERROR";

    int line;
    int column;
    String message;
    IssueSeverity severity;
    String code;
}
