package com.legacy.cobol.docs.dto.parser;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * "This program depends on {@code target}", as found on one source line.
 */
@Value
@Builder
public class ProgramDependency {
    DependencyKind type;
    String target;
    int line;
    String context;
    @JsonProperty("isCritical")
    boolean critical;
    List<String> parameters;
}
