package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InputOutputSection {
    @Builder.Default
    List<FileControlEntry> fileControl = List.of();
}
