package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

/**
 * One {@code SELECT ... ASSIGN TO ...} entry of FILE-CONTROL.
 */
@Value
@Builder
public class FileControlEntry {
    String fileName;
    String assignTo;
    String organization;
    String accessMode;
    String recordKey;
    String fileStatus;
    int line;
}
