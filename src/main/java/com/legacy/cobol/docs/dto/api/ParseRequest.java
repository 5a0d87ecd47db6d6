package com.legacy.cobol.docs.dto.api;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseRequest {
    @NotNull
    private String source;            // COBOL source text
    private Boolean nestDataItems;    // optional, group data items by level number
}
