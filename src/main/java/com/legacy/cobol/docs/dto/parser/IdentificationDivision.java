package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IdentificationDivision {
    @Builder.Default
    String programId = "";
    String author;
    String dateWritten;
    String dateCompiled;
    String security;
    String remarks;
}
