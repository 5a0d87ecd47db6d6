package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Paragraph {
    String name;
    int startLine;
    int endLine;
    @Builder.Default
    List<Statement> statements = List.of();
}
