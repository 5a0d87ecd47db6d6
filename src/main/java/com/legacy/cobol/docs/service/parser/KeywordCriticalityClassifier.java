package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.DependencyKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Flags a CALL as critical when its line mentions one of a few marker words.
 * Copybook and SQL includes are never critical.
 */
@Component
public class KeywordCriticalityClassifier implements DependencyCriticalityClassifier {

    private static final List<String> MARKERS = List.of("critical", "essential", "required");

    @Override
    public boolean isCritical(DependencyKind kind, String line) {
        if (kind != DependencyKind.CALL || line == null) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(lower::contains);
    }
}
