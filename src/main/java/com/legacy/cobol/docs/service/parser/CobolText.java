package com.legacy.cobol.docs.service.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Small text helpers shared by the line parsers.
 */
final class CobolText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern QUOTED_LITERAL = Pattern.compile("'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"");
    private static final Set<String> PASSING_MODES = Set.of("BY", "REFERENCE", "CONTENT", "VALUE");

    private CobolText() {
    }

    static List<String> words(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) return result;
        for (String word : WHITESPACE.split(text.trim())) {
            if (!word.isEmpty()) {
                result.add(word);
            }
        }
        return result;
    }

    static String stripTrailingPeriod(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    static String stripQuotes(String text) {
        if (text == null || text.length() < 2) return text;
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        if ((first == '\'' || first == '"') && first == last) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    /** Replaces quoted literals with a single blank so their words are not read as names. */
    static String withoutLiterals(String text) {
        return QUOTED_LITERAL.matcher(text).replaceAll(" ");
    }

    /**
     * Operands of a USING clause: whitespace separated, trailing periods and commas removed,
     * BY REFERENCE / BY CONTENT / BY VALUE markers dropped.
     */
    static List<String> usingOperands(String clause) {
        List<String> operands = new ArrayList<>();
        for (String word : words(clause)) {
            String operand = stripTrailingPeriod(word);
            if (operand.endsWith(",")) {
                operand = operand.substring(0, operand.length() - 1);
            }
            if (operand.isEmpty() || PASSING_MODES.contains(operand.toUpperCase(Locale.ROOT))) {
                continue;
            }
            operands.add(operand);
        }
        return operands;
    }
}
