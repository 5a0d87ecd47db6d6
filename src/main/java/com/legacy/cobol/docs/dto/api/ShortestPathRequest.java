package com.legacy.cobol.docs.dto.api;

import com.legacy.cobol.docs.model.Dependency;
import com.legacy.cobol.docs.model.Program;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShortestPathRequest {
    @NotNull
    @Valid
    private List<Program> programs;
    @NotNull
    @Valid
    private List<Dependency> dependencies;
    @NotBlank
    private String from;   // node id, e.g. program-1
    @NotBlank
    private String to;
}
