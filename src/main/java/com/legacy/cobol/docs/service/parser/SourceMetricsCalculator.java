package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.config.ParserProperties;
import com.legacy.cobol.docs.dto.parser.SourceMetrics;
import com.legacy.cobol.docs.dto.parser.StatementVerb;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-count based size and complexity figures for one source text.
 */
@Service
@RequiredArgsConstructor
public class SourceMetricsCalculator {

    private static final Pattern PROCEDURE_NAME = Pattern.compile("^([A-Z0-9\\-_]+)\\.\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATA_DESCRIPTION = Pattern.compile("^\\d{2}\\s+[A-Z0-9\\-]+", Pattern.CASE_INSENSITIVE);
    private static final String[] DECISION_POINTS = {" IF ", "WHEN ", "PERFORM UNTIL", "PERFORM VARYING"};

    private final ParserProperties parserProperties;

    public SourceMetrics calculate(String source) {
        SourceLines lines = SourceLines.of(source);
        int linesOfCode = 0;
        int commentLines = 0;
        int blankLines = 0;
        int complexity = 1;
        int procedures = 0;
        int dataItems = 0;

        for (int i = 0; i < lines.size(); i++) {
            if (lines.isBlank(i)) {
                blankLines++;
                continue;
            }
            if (lines.isComment(i)) {
                commentLines++;
                continue;
            }
            linesOfCode++;

            String upper = lines.raw(i).toUpperCase(Locale.ROOT);
            for (String decision : DECISION_POINTS) {
                if (upper.contains(decision)) {
                    complexity++;
                    break;
                }
            }
            String text = lines.text(i);
            if (isProcedureName(lines, i, text)) {
                procedures++;
            }
            if (DATA_DESCRIPTION.matcher(text).find()) {
                dataItems++;
            }
        }

        return SourceMetrics.builder()
                .linesOfCode(linesOfCode)
                .commentLines(commentLines)
                .blankLines(blankLines)
                .cyclomaticComplexity(complexity)
                .maintainabilityIndex(maintainabilityIndex(linesOfCode, commentLines))
                .procedures(procedures)
                .dataItems(dataItems)
                .build();
    }

    private boolean isProcedureName(SourceLines lines, int index, String text) {
        if (lines.indent(index) >= parserProperties.getAreaBColumn() - 1) {
            return false;
        }
        Matcher matcher = PROCEDURE_NAME.matcher(text);
        return matcher.matches() && !StatementVerb.isVerb(matcher.group(1));
    }

    static int maintainabilityIndex(int linesOfCode, int commentLines) {
        int total = linesOfCode + commentLines;
        double commentRatio = total == 0 ? 0.0 : (double) commentLines / total;
        return (int) Math.round(100 - (linesOfCode / 10.0) + (commentRatio * 20));
    }
}
