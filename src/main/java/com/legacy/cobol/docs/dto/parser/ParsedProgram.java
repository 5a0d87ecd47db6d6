package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structural view of one COBOL source text. Produced by a single parse call and never
 * modified afterwards.
 */
@Value
@Builder(toBuilder = true)
public class ParsedProgram {

    public static final String UNKNOWN_PROGRAM_ID = "UNKNOWN";

    Divisions divisions;
    @Builder.Default
    List<ParseIssue> errors = List.of();
    @Builder.Default
    List<ParseIssue> warnings = List.of();
    @Builder.Default
    List<ProgramDependency> dependencies = List.of();
    @Builder.Default
    List<CrossReference> crossReferences = List.of();

    /**
     * PROGRAM-ID, or {@value #UNKNOWN_PROGRAM_ID} when the IDENTIFICATION DIVISION or its
     * PROGRAM-ID entry is missing.
     */
    @JsonIgnore
    public String getProgramIdOrUnknown() {
        if (divisions == null || divisions.getIdentification() == null) {
            return UNKNOWN_PROGRAM_ID;
        }
        String programId = divisions.getIdentification().getProgramId();
        return programId == null || programId.isEmpty() ? UNKNOWN_PROGRAM_ID : programId;
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
