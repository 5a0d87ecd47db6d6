package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProcedureDivision {
    List<String> usingClause;
    String givingClause;
    @Builder.Default
    List<Paragraph> paragraphs = List.of();
    @Builder.Default
    List<ProcedureSection> sections = List.of();
}
