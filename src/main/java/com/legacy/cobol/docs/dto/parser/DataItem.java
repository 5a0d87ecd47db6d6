package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A leveled DATA DIVISION entry. The parser emits items as a flat list in line order,
 * so {@code children} stays empty unless the list is passed through
 * {@code DataItemHierarchyBuilder}.
 */
@Value
@Builder(toBuilder = true)
public class DataItem {
    int level;
    String name;
    String picture;
    String value;
    String usage;
    Occurs occurs;
    String redefines;
    int line;
    @Builder.Default
    List<DataItem> children = List.of();
}
