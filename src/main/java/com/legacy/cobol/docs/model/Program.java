package com.legacy.cobol.docs.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A COBOL program (or copybook / JCL member) as stored by the persistence layer.
 * Only the fields the dependency analyzer reads are modelled here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Program {

    @NotNull
    private Long id;

    @NotBlank
    private String name;

    private String filename;

    private String programType; // main, subroutine, copybook, jcl

    private int linesOfCode;

    private int complexity;

    private String author;

    private Instant updatedAt;
}
