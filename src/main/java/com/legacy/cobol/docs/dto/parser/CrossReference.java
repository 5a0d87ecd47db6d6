package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CrossReference {
    String name;
    CrossReferenceType type;
    @Builder.Default
    List<Integer> defined = List.of();
    @Builder.Default
    List<Integer> referenced = List.of();
    @Builder.Default
    List<Integer> modified = List.of();
}
