package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A PROCEDURE DIVISION section and the paragraphs declared inside it.
 */
@Value
@Builder
public class ProcedureSection {
    String name;
    int line;
    @Builder.Default
    List<Paragraph> paragraphs = List.of();
}
