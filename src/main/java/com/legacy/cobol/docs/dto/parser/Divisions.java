package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

/**
 * The four COBOL divisions. Any of them may be null when not found in the source.
 */
@Value
@Builder(toBuilder = true)
public class Divisions {
    IdentificationDivision identification;
    EnvironmentDivision environment;
    DataDivision data;
    ProcedureDivision procedure;
}
