package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConfigurationSection {
    String sourceComputer;
    String objectComputer;
    @Builder.Default
    List<SpecialName> specialNames = List.of();
}
