package com.legacy.cobol.docs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed relationship between two stored programs: {@code fromProgramId} depends on
 * {@code toProgramId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dependency {

    @NotNull
    private Long id;

    private Long fromProgramId;

    private Long toProgramId;

    private String dependencyType; // call, copy, data_flow, control_flow

    private Integer lineNumber;

    @JsonProperty("isCritical")
    private boolean critical;

    @JsonProperty("isCircular")
    private boolean circular;
}
