package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

/**
 * Size and complexity figures for one source text.
 */
@Value
@Builder
public class SourceMetrics {
    int linesOfCode;
    int commentLines;
    int blankLines;
    int cyclomaticComplexity;
    int maintainabilityIndex;
    int procedures;
    int dataItems;
}
