package com.legacy.cobol.docs.dto.parser;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class DataDivision {
    @Builder.Default
    List<FileDescription> fileSection = List.of();
    @Builder.Default
    List<DataItem> workingStorageSection = List.of();
    @Builder.Default
    List<DataItem> localStorageSection = List.of();
    @Builder.Default
    List<DataItem> linkageSection = List.of();
}
