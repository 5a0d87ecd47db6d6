package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.DependencyKind;
import com.legacy.cobol.docs.dto.parser.ProgramDependency;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds static CALLs, COPY statements and EXEC SQL INCLUDEs anywhere in the text.
 * Every line is scanned independently of the division structure; dynamic calls
 * ({@code CALL WS-PROGRAM}) are not recognized.
 */
final class DependencyExtractor {

    private static final Pattern CALL =
            Pattern.compile("(?<![\\w-])CALL\\s+['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALL_USING =
            Pattern.compile("\\bUSING\\s+(.+?)(?:\\s+GIVING\\b|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COPY =
            Pattern.compile("(?<![\\w-])COPY\\s+['\"]?([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SQL_INCLUDE =
            Pattern.compile("EXEC\\s+SQL\\s+INCLUDE\\s+([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);

    private final DependencyCriticalityClassifier classifier;

    DependencyExtractor(DependencyCriticalityClassifier classifier) {
        this.classifier = classifier;
    }

    List<ProgramDependency> extract(SourceLines lines) {
        List<ProgramDependency> dependencies = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.text(i);
            if (text.isEmpty()) continue;

            Matcher call = CALL.matcher(text);
            if (call.find()) {
                Matcher using = CALL_USING.matcher(text.substring(call.end()));
                dependencies.add(dependency(DependencyKind.CALL, call.group(1), i + 1, text,
                        using.find() ? CobolText.usingOperands(using.group(1)) : null));
            }

            Matcher copy = COPY.matcher(text);
            if (copy.find()) {
                dependencies.add(dependency(DependencyKind.COPY, copy.group(1), i + 1, text, null));
            }

            Matcher include = SQL_INCLUDE.matcher(text);
            if (include.find()) {
                dependencies.add(dependency(DependencyKind.INCLUDE, include.group(1), i + 1, text, null));
            }
        }
        return dependencies;
    }

    private ProgramDependency dependency(DependencyKind kind, String target, int line, String context,
                                         List<String> parameters) {
        return ProgramDependency.builder()
                .type(kind)
                .target(target)
                .line(line)
                .context(context)
                .critical(classifier.isCritical(kind, context))
                .parameters(parameters)
                .build();
    }
}
