package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.DataDivision;
import com.legacy.cobol.docs.dto.parser.DataItem;
import com.legacy.cobol.docs.dto.parser.FileDescription;
import com.legacy.cobol.docs.dto.parser.Occurs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the DATA DIVISION into flat, line-ordered item lists per section.
 *
 * <p>A section runs from its header to the next section header or PROCEDURE DIVISION.
 * An entry that does not end with a period continues on the following lines until one does
 * or a new level number starts.
 */
final class DataDivisionParser {

    private static final Pattern DATA_HEADER =
            Pattern.compile("^\\s*DATA\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROCEDURE_HEADER =
            Pattern.compile("^\\s*PROCEDURE\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION_HEADER =
            Pattern.compile("^\\s*([A-Z0-9\\-]+)\\s+SECTION\\s*\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_DESCRIPTION =
            Pattern.compile("^(FD|SD)\\s+([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEVEL_ENTRY =
            Pattern.compile("^(\\d{1,2})\\s+(.+)$");
    private static final Pattern LEVEL_START =
            Pattern.compile("^\\d{1,2}\\s+");
    private static final Pattern ITEM_NAME =
            Pattern.compile("^([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PICTURE =
            Pattern.compile("(?<![\\w-])PIC(?:TURE)?\\s+(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALUE =
            Pattern.compile("(?<![\\w-])VALUES?\\s+(?:IS\\s+|ARE\\s+)?('(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|\\S+)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern USAGE =
            Pattern.compile("(?<![\\w-])(?:USAGE\\s+(?:IS\\s+)?)?"
                            + "(COMP(?:UTATIONAL)?(?:-[1-5])?|BINARY|PACKED-DECIMAL|DISPLAY|INDEX|POINTER)(?![\\w-])",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern OCCURS =
            Pattern.compile("(?<![\\w-])OCCURS\\s+(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REDEFINES =
            Pattern.compile("(?<![\\w-])REDEFINES\\s+(\\S+)", Pattern.CASE_INSENSITIVE);

    DataDivision parse(SourceLines lines, ParseContext context) {
        int header = lines.find(DATA_HEADER, context.cursor());
        if (header < 0) {
            return null;
        }
        context.moveCursor(header + 1);

        int end = lines.find(PROCEDURE_HEADER, header + 1);
        if (end < 0) end = lines.size();

        DataDivision.DataDivisionBuilder builder = DataDivision.builder();
        int i = header + 1;
        while (i < end) {
            Matcher section = lines.isComment(i) ? null : lines.match(SECTION_HEADER, i);
            if (section == null) {
                i++;
                continue;
            }
            int sectionEnd = nextSection(lines, i + 1, end);
            switch (section.group(1).toUpperCase(Locale.ROOT)) {
                case "FILE" -> builder.fileSection(parseFileSection(lines, i + 1, sectionEnd));
                case "WORKING-STORAGE" -> builder.workingStorageSection(parseItems(lines, i + 1, sectionEnd));
                case "LOCAL-STORAGE" -> builder.localStorageSection(parseItems(lines, i + 1, sectionEnd));
                case "LINKAGE" -> builder.linkageSection(parseItems(lines, i + 1, sectionEnd));
                default -> {
                    // REPORT, SCREEN and COMMUNICATION sections are not modelled
                }
            }
            i = sectionEnd;
        }
        return builder.build();
    }

    private int nextSection(SourceLines lines, int from, int end) {
        int next = lines.find(SECTION_HEADER, from, end);
        return next < 0 ? end : next;
    }

    private List<FileDescription> parseFileSection(SourceLines lines, int from, int to) {
        List<FileDescription> descriptions = new ArrayList<>();
        int i = from;
        while (i < to) {
            if (lines.isIgnorable(i)) {
                i++;
                continue;
            }
            Matcher fd = FILE_DESCRIPTION.matcher(lines.text(i));
            if (!fd.find()) {
                i++;
                continue;
            }
            int recordsEnd = i + 1;
            while (recordsEnd < to && (lines.isIgnorable(recordsEnd)
                    || !FILE_DESCRIPTION.matcher(lines.text(recordsEnd)).find())) {
                recordsEnd++;
            }
            descriptions.add(FileDescription.builder()
                    .fileName(fd.group(2))
                    .line(i + 1)
                    .records(parseItems(lines, i + 1, recordsEnd))
                    .build());
            i = recordsEnd;
        }
        return descriptions;
    }

    private List<DataItem> parseItems(SourceLines lines, int from, int to) {
        List<DataItem> items = new ArrayList<>();
        int i = from;
        while (i < to) {
            if (lines.isIgnorable(i) || !LEVEL_ENTRY.matcher(lines.text(i)).matches()) {
                i++;
                continue;
            }
            int itemLine = i;
            StringBuilder entry = new StringBuilder(lines.text(i));
            while (!entry.toString().endsWith(".") && i + 1 < to
                    && (lines.isIgnorable(i + 1) || !LEVEL_START.matcher(lines.text(i + 1)).find())) {
                i++;
                if (!lines.isIgnorable(i)) {
                    entry.append(' ').append(lines.text(i));
                }
            }
            DataItem item = parseItem(entry.toString(), itemLine + 1);
            if (item != null) {
                items.add(item);
            }
            i++;
        }
        return items;
    }

    /**
     * Reads one data description entry, for example
     * {@code 05 WS-AMOUNT PIC S9(7)V99 COMP-3 VALUE ZERO.}
     */
    DataItem parseItem(String entry, int line) {
        Matcher level = LEVEL_ENTRY.matcher(entry.trim());
        if (!level.matches()) return null;

        String rest = CobolText.stripTrailingPeriod(level.group(2));
        Matcher name = ITEM_NAME.matcher(rest);
        if (!name.find()) return null;
        String clauses = rest.substring(name.end());
        String unquoted = CobolText.withoutLiterals(clauses);

        return DataItem.builder()
                .level(Integer.parseInt(level.group(1)))
                .name(name.group(1))
                .picture(firstGroup(PICTURE, unquoted))
                .value(firstGroup(VALUE, clauses))
                .usage(usage(unquoted))
                .occurs(occurs(unquoted))
                .redefines(firstGroup(REDEFINES, unquoted))
                .line(line)
                .build();
    }

    private String usage(String clauses) {
        String usage = firstGroup(USAGE, clauses);
        return usage == null ? null : usage.toUpperCase(Locale.ROOT);
    }

    private Occurs occurs(String clauses) {
        String raw = firstGroup(OCCURS, clauses);
        return raw == null ? null : Occurs.of(raw);
    }

    private String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }
}
