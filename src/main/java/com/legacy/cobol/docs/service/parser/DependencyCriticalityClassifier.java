package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.DependencyKind;

/**
 * Decides whether a dependency found on a source line should be flagged as critical.
 */
public interface DependencyCriticalityClassifier {

    boolean isCritical(DependencyKind kind, String line);
}
