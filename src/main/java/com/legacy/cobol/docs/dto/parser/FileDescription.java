package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * An FD or SD entry of the FILE SECTION with the record items that follow it.
 */
@Value
@Builder(toBuilder = true)
public class FileDescription {
    String fileName;
    int line;
    @Builder.Default
    List<DataItem> records = List.of();
}
