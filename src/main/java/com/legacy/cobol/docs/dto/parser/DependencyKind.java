package com.legacy.cobol.docs.dto.parser;

/**
 * How a program refers to another source unit.
 */
public enum DependencyKind {
    CALL,     // runtime program invocation
    COPY,     // compile-time copybook inclusion
    INCLUDE   // EXEC SQL INCLUDE member
}
