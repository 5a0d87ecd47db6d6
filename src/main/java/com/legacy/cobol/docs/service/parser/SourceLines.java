package com.legacy.cobol.docs.service.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line view of one COBOL source text, shared by every parsing step.
 *
 * <p>Lines are split on LF (a trailing CR is dropped). When the first six columns of a line
 * hold a fixed-format sequence number they are blanked, so column positions are preserved
 * and {@code ^\s*} patterns see the program text. Such lines also lose the identification
 * area (column 73 on). Indexes are 0-based; callers report 1-based line numbers.
 */
final class SourceLines {

    private static final Pattern SEQUENCE_AREA = Pattern.compile("^\\d{6}(?=[ *\\-/dD]|$)");
    private static final String BLANK_SEQUENCE = "      ";
    private static final int PROGRAM_AREA_END = 72;

    private final List<String> lines;

    private SourceLines(List<String> lines) {
        this.lines = lines;
    }

    static SourceLines of(String text) {
        if (text == null || text.isEmpty()) {
            return new SourceLines(Collections.emptyList());
        }
        String[] split = text.split("\n", -1);
        List<String> normalized = new ArrayList<>(split.length);
        for (String line : split) {
            String withoutCr = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            if (SEQUENCE_AREA.matcher(withoutCr).find()) {
                String programArea = withoutCr.length() > PROGRAM_AREA_END
                        ? withoutCr.substring(0, PROGRAM_AREA_END)
                        : withoutCr;
                normalized.add(BLANK_SEQUENCE + programArea.substring(6));
            } else {
                normalized.add(withoutCr);
            }
        }
        return new SourceLines(Collections.unmodifiableList(normalized));
    }

    int size() {
        return lines.size();
    }

    String raw(int index) {
        return lines.get(index);
    }

    String text(int index) {
        return lines.get(index).trim();
    }

    boolean isBlank(int index) {
        return lines.get(index).isBlank();
    }

    /**
     * Full-line comment: an indicator ({@code *} or {@code /}) in column 7 after a blank
     * sequence area, or a line whose first non-blank characters are {@code *}.
     */
    boolean isComment(int index) {
        String line = lines.get(index);
        if (line.length() > 6 && line.substring(0, 6).isBlank()) {
            char indicator = line.charAt(6);
            if (indicator == '*' || indicator == '/') {
                return true;
            }
        }
        return line.trim().startsWith("*");
    }

    /** Comment or blank. */
    boolean isIgnorable(int index) {
        return isBlank(index) || isComment(index);
    }

    /** Number of leading blanks; a tab counts as one column. */
    int indent(int index) {
        String line = lines.get(index);
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }

    /**
     * First index in {@code [from, to)} whose line matches {@code pattern}, or -1.
     * Comment lines never match.
     */
    int find(Pattern pattern, int from, int to) {
        int end = Math.min(to, lines.size());
        for (int i = Math.max(0, from); i < end; i++) {
            if (!isComment(i) && pattern.matcher(lines.get(i)).find()) {
                return i;
            }
        }
        return -1;
    }

    int find(Pattern pattern, int from) {
        return find(pattern, from, lines.size());
    }

    /**
     * Matcher positioned on the first match of {@code pattern} in the line at {@code index},
     * or null when the line does not match.
     */
    Matcher match(Pattern pattern, int index) {
        Matcher matcher = pattern.matcher(lines.get(index));
        return matcher.find() ? matcher : null;
    }
}
