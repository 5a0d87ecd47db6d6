package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Statement {
    StatementVerb verb;
    String keyword;    // first word as written, upper-cased
    int line;
    String content;
    @Builder.Default
    List<String> operands = List.of();
    List<Condition> conditions;  // IF statements only
}
