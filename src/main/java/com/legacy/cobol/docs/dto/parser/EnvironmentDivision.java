package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EnvironmentDivision {
    ConfigurationSection configurationSection;
    InputOutputSection inputOutputSection;
}
