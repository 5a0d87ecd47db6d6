package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.ConfigurationSection;
import com.legacy.cobol.docs.dto.parser.EnvironmentDivision;
import com.legacy.cobol.docs.dto.parser.FileControlEntry;
import com.legacy.cobol.docs.dto.parser.IdentificationDivision;
import com.legacy.cobol.docs.dto.parser.InputOutputSection;
import com.legacy.cobol.docs.dto.parser.ParseIssue;
import com.legacy.cobol.docs.dto.parser.SpecialName;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the IDENTIFICATION and ENVIRONMENT divisions.
 *
 * <p>Divisions are located with a forward cursor: IDENTIFICATION is searched from the top
 * and every later division from the line after the previous header that was found.
 */
final class DivisionParser {

    private static final Pattern IDENTIFICATION_HEADER =
            Pattern.compile("^\\s*(IDENTIFICATION|ID)\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENVIRONMENT_HEADER =
            Pattern.compile("^\\s*ENVIRONMENT\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern LATER_DIVISION_HEADER =
            Pattern.compile("^\\s*(DATA|PROCEDURE)\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROGRAM_ID =
            Pattern.compile("^\\s*PROGRAM-ID\\.\\s*(.+?)\\.?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONFIGURATION_SECTION =
            Pattern.compile("^\\s*CONFIGURATION\\s+SECTION", Pattern.CASE_INSENSITIVE);
    private static final Pattern INPUT_OUTPUT_SECTION =
            Pattern.compile("^\\s*INPUT-OUTPUT\\s+SECTION", Pattern.CASE_INSENSITIVE);
    private static final Pattern SOURCE_COMPUTER =
            Pattern.compile("^\\s*SOURCE-COMPUTER\\.\\s*(.*?)\\.*\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_COMPUTER =
            Pattern.compile("^\\s*OBJECT-COMPUTER\\.\\s*(.*?)\\.*\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPECIAL_NAMES =
            Pattern.compile("^\\s*SPECIAL-NAMES\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPECIAL_NAME_ENTRY =
            Pattern.compile("([A-Z0-9\\-]+)\\s+IS\\s+([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_CONTROL =
            Pattern.compile("^\\s*FILE-CONTROL\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENVIRONMENT_PARAGRAPH =
            Pattern.compile("^\\s*(INPUT-OUTPUT\\s+SECTION|FILE-CONTROL\\.|I-O-CONTROL\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT =
            Pattern.compile("^\\s*SELECT\\s+(?:OPTIONAL\\s+)?([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSIGN =
            Pattern.compile("\\bASSIGN\\s+(?:TO\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORGANIZATION =
            Pattern.compile("\\bORGANIZATION\\s+(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACCESS_MODE =
            Pattern.compile("\\bACCESS\\s+(?:MODE\\s+)?(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECORD_KEY =
            Pattern.compile("(?<!ALTERNATE )\\bRECORD\\s+KEY\\s+(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_STATUS =
            Pattern.compile("\\b(?:FILE\\s+)?STATUS\\s+(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);

    // ========================= IDENTIFICATION =========================

    IdentificationDivision parseIdentification(SourceLines lines, ParseContext context) {
        int header = lines.find(IDENTIFICATION_HEADER, context.cursor());
        if (header < 0) {
            context.error(0, 0, "IDENTIFICATION DIVISION not found", ParseIssue.MISSING_DIVISION);
            return null;
        }
        context.moveCursor(header + 1);

        IdentificationDivision.IdentificationDivisionBuilder builder = IdentificationDivision.builder();
        int programIdLine = lines.find(PROGRAM_ID, context.cursor());
        if (programIdLine < 0) {
            context.error(header + 1, 0, "PROGRAM-ID not found", ParseIssue.MISSING_PROGRAM_ID);
        } else {
            Matcher matcher = lines.match(PROGRAM_ID, programIdLine);
            builder.programId(programName(matcher.group(1)));
        }

        builder.author(optionalEntry(lines, "AUTHOR", context.cursor()));
        builder.dateWritten(optionalEntry(lines, "DATE-WRITTEN", context.cursor()));
        builder.dateCompiled(optionalEntry(lines, "DATE-COMPILED", context.cursor()));
        builder.security(optionalEntry(lines, "SECURITY", context.cursor()));
        builder.remarks(optionalEntry(lines, "REMARKS", context.cursor()));
        return builder.build();
    }

    /** First word of the PROGRAM-ID entry, without quotes; "PAYROLL IS INITIAL" gives PAYROLL. */
    private String programName(String entry) {
        List<String> words = CobolText.words(entry);
        if (words.isEmpty()) return "";
        return CobolText.stripQuotes(CobolText.stripTrailingPeriod(words.get(0)));
    }

    private String optionalEntry(SourceLines lines, String keyword, int from) {
        Pattern pattern = Pattern.compile("^\\s*" + Pattern.quote(keyword) + "\\.\\s*(.+?)\\.*\\s*$",
                Pattern.CASE_INSENSITIVE);
        int index = lines.find(pattern, from);
        if (index < 0) return null;
        return lines.match(pattern, index).group(1).trim();
    }

    // ========================= ENVIRONMENT =========================

    EnvironmentDivision parseEnvironment(SourceLines lines, ParseContext context) {
        int header = lines.find(ENVIRONMENT_HEADER, context.cursor());
        if (header < 0) {
            return null;
        }
        context.moveCursor(header + 1);

        int end = lines.find(LATER_DIVISION_HEADER, header + 1);
        if (end < 0) end = lines.size();

        return EnvironmentDivision.builder()
                .configurationSection(parseConfiguration(lines, header + 1, end))
                .inputOutputSection(parseInputOutput(lines, header + 1, end))
                .build();
    }

    private ConfigurationSection parseConfiguration(SourceLines lines, int from, int end) {
        int section = lines.find(CONFIGURATION_SECTION, from, end);
        if (section < 0) return null;

        int sectionEnd = lines.find(INPUT_OUTPUT_SECTION, section + 1, end);
        if (sectionEnd < 0) sectionEnd = end;

        ConfigurationSection.ConfigurationSectionBuilder builder = ConfigurationSection.builder();
        int sourceComputer = lines.find(SOURCE_COMPUTER, section + 1, sectionEnd);
        if (sourceComputer >= 0) {
            builder.sourceComputer(emptyToNull(lines.match(SOURCE_COMPUTER, sourceComputer).group(1)));
        }
        int objectComputer = lines.find(OBJECT_COMPUTER, section + 1, sectionEnd);
        if (objectComputer >= 0) {
            builder.objectComputer(emptyToNull(lines.match(OBJECT_COMPUTER, objectComputer).group(1)));
        }

        int specialNames = lines.find(SPECIAL_NAMES, section + 1, sectionEnd);
        if (specialNames >= 0) {
            List<SpecialName> names = new ArrayList<>();
            for (int i = specialNames; i < sectionEnd; i++) {
                if (i > specialNames && lines.match(ENVIRONMENT_PARAGRAPH, i) != null) break;
                if (lines.isIgnorable(i)) continue;
                Matcher matcher = SPECIAL_NAME_ENTRY.matcher(lines.text(i));
                while (matcher.find()) {
                    names.add(SpecialName.builder()
                            .name(matcher.group(1))
                            .value(matcher.group(2))
                            .build());
                }
            }
            builder.specialNames(names);
        }
        return builder.build();
    }

    private InputOutputSection parseInputOutput(SourceLines lines, int from, int end) {
        int section = lines.find(INPUT_OUTPUT_SECTION, from, end);
        if (section < 0) return null;

        List<FileControlEntry> entries = new ArrayList<>();
        int fileControl = lines.find(FILE_CONTROL, section + 1, end);
        if (fileControl >= 0) {
            int i = fileControl + 1;
            while (i < end) {
                if (lines.isIgnorable(i) || lines.match(SELECT, i) == null) {
                    i++;
                    continue;
                }
                int selectLine = i;
                StringBuilder statement = new StringBuilder(lines.text(i));
                while (!statement.toString().endsWith(".") && i + 1 < end
                        && lines.match(SELECT, i + 1) == null) {
                    i++;
                    if (!lines.isIgnorable(i)) {
                        statement.append(' ').append(lines.text(i));
                    }
                }
                entries.add(fileControlEntry(statement.toString(), selectLine + 1));
                i++;
            }
        }
        return InputOutputSection.builder().fileControl(entries).build();
    }

    private FileControlEntry fileControlEntry(String statement, int line) {
        Matcher select = SELECT.matcher(statement);
        select.find();
        return FileControlEntry.builder()
                .fileName(select.group(1))
                .assignTo(clause(ASSIGN, statement))
                .organization(clause(ORGANIZATION, statement))
                .accessMode(clause(ACCESS_MODE, statement))
                .recordKey(clause(RECORD_KEY, statement))
                .fileStatus(clause(FILE_STATUS, statement))
                .line(line)
                .build();
    }

    private String clause(Pattern pattern, String statement) {
        Matcher matcher = pattern.matcher(statement);
        if (!matcher.find()) return null;
        return CobolText.stripQuotes(CobolText.stripTrailingPeriod(matcher.group(1)));
    }

    private String emptyToNull(String value) {
        String trimmed = value == null ? "" : value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
