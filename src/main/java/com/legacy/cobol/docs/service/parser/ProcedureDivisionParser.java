package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.ParseIssue;
import com.legacy.cobol.docs.dto.parser.Paragraph;
import com.legacy.cobol.docs.dto.parser.ProcedureDivision;
import com.legacy.cobol.docs.dto.parser.ProcedureSection;
import com.legacy.cobol.docs.dto.parser.Statement;
import com.legacy.cobol.docs.dto.parser.StatementVerb;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the PROCEDURE DIVISION: USING/GIVING, sections, paragraphs and their statements.
 *
 * <p>A paragraph header is a lone name followed by a period that starts in Area A, i.e.
 * before the configured Area B column. Statement keywords and {@code END-} scope
 * terminators are never headers, so {@code STOP RUN.} or {@code EXIT.} stay statements.
 */
final class ProcedureDivisionParser {

    private static final Pattern PROCEDURE_HEADER =
            Pattern.compile("^\\s*PROCEDURE\\s+DIVISION", Pattern.CASE_INSENSITIVE);
    private static final Pattern USING =
            Pattern.compile("\\bUSING\\s+(.+?)(?:\\s+(?:GIVING|RETURNING)\\b|\\.|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GIVING =
            Pattern.compile("\\b(?:GIVING|RETURNING)\\s+([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION_HEADER =
            Pattern.compile("^\\s*([A-Z0-9\\-]+)\\s+SECTION\\s*\\.", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAGRAPH_HEADER =
            Pattern.compile("^([A-Z0-9\\-]+)\\.\\s*$", Pattern.CASE_INSENSITIVE);

    private final int areaBColumn;
    private final StatementParser statementParser = new StatementParser();

    /**
     * @param areaBColumn 1-based column where Area B starts; headers must begin before it
     */
    ProcedureDivisionParser(int areaBColumn) {
        this.areaBColumn = areaBColumn;
    }

    ProcedureDivision parse(SourceLines lines, ParseContext context) {
        int header = lines.find(PROCEDURE_HEADER, context.cursor());
        if (header < 0) {
            context.error(0, 0, "PROCEDURE DIVISION not found", ParseIssue.MISSING_DIVISION);
            return null;
        }
        context.moveCursor(header + 1);

        String headerText = lines.text(header);
        Matcher using = USING.matcher(headerText);
        Matcher giving = GIVING.matcher(headerText);

        List<Paragraph> paragraphs = new ArrayList<>();
        List<SectionDraft> sections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        ParagraphDraft current = null;
        SectionDraft currentSection = null;

        for (int i = header + 1; i < lines.size(); i++) {
            if (lines.isIgnorable(i)) {
                continue;
            }
            Matcher section = lines.match(SECTION_HEADER, i);
            if (section != null) {
                closeParagraph(current, i, paragraphs, currentSection);
                current = null;
                currentSection = new SectionDraft(section.group(1), i + 1);
                sections.add(currentSection);
                continue;
            }
            String name = paragraphName(lines, i);
            if (name != null) {
                closeParagraph(current, i, paragraphs, currentSection);
                if (!seen.add(name.toUpperCase(Locale.ROOT))) {
                    context.warning(i + 1, lines.indent(i) + 1,
                            "Duplicate paragraph name: " + name, ParseIssue.DUPLICATE_PARAGRAPH);
                }
                current = new ParagraphDraft(name, i + 1);
                continue;
            }
            if (current != null) {
                Statement statement = statementParser.parse(lines.text(i), i + 1);
                if (statement != null) {
                    current.statements.add(statement);
                }
            }
        }
        closeParagraph(current, lines.size(), paragraphs, currentSection);

        return ProcedureDivision.builder()
                .usingClause(using.find() ? CobolText.usingOperands(using.group(1)) : null)
                .givingClause(giving.find() ? giving.group(1) : null)
                .paragraphs(paragraphs)
                .sections(sections.stream().map(SectionDraft::build).toList())
                .build();
    }

    private String paragraphName(SourceLines lines, int index) {
        if (lines.indent(index) >= areaBColumn - 1) {
            return null;
        }
        Matcher matcher = PARAGRAPH_HEADER.matcher(lines.text(index));
        if (!matcher.matches()) {
            return null;
        }
        String name = matcher.group(1);
        String upper = name.toUpperCase(Locale.ROOT);
        if (StatementVerb.isVerb(upper) || upper.startsWith("END-") || "DECLARATIVES".equals(upper)) {
            return null;
        }
        return name;
    }

    /** {@code endLine} is the 1-based number of the line before the boundary at 0-based {@code boundary}. */
    private void closeParagraph(ParagraphDraft draft, int boundary, List<Paragraph> paragraphs,
                                SectionDraft section) {
        if (draft == null) return;
        Paragraph paragraph = Paragraph.builder()
                .name(draft.name)
                .startLine(draft.startLine)
                .endLine(boundary)
                .statements(List.copyOf(draft.statements))
                .build();
        paragraphs.add(paragraph);
        if (section != null) {
            section.paragraphs.add(paragraph);
        }
    }

    private static final class ParagraphDraft {
        private final String name;
        private final int startLine;
        private final List<Statement> statements = new ArrayList<>();

        private ParagraphDraft(String name, int startLine) {
            this.name = name;
            this.startLine = startLine;
        }
    }

    private static final class SectionDraft {
        private final String name;
        private final int line;
        private final List<Paragraph> paragraphs = new ArrayList<>();

        private SectionDraft(String name, int line) {
            this.name = name;
            this.line = line;
        }

        private ProcedureSection build() {
            return ProcedureSection.builder()
                    .name(name)
                    .line(line)
                    .paragraphs(List.copyOf(paragraphs))
                    .build();
        }
    }
}
