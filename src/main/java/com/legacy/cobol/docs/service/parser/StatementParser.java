package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.Condition;
import com.legacy.cobol.docs.dto.parser.ConditionType;
import com.legacy.cobol.docs.dto.parser.Statement;
import com.legacy.cobol.docs.dto.parser.StatementVerb;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one procedure line into a {@link Statement}. Each line is read on its own:
 * a statement spanning several lines yields one {@code OTHER} statement per continuation line.
 */
final class StatementParser {

    private static final Pattern KEYWORD = Pattern.compile("^([A-Z\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIMPLE_CONDITION =
            Pattern.compile("(\\S+)\\s+(>=|<=|NOT\\s*=|=|>|<)\\s+(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_EQUAL = Pattern.compile("NOT\\s*=", Pattern.CASE_INSENSITIVE);

    /**
     * @param content trimmed line text
     * @param line    1-based line number
     * @return the statement, or null when the line does not start with a word
     */
    Statement parse(String content, int line) {
        Matcher keywordMatcher = KEYWORD.matcher(content);
        if (!keywordMatcher.find()) {
            return null;
        }
        String keyword = keywordMatcher.group(1).toUpperCase(Locale.ROOT);
        StatementVerb verb = StatementVerb.fromKeyword(keyword);
        String rest = content.substring(keywordMatcher.end()).trim();

        Statement.StatementBuilder builder = Statement.builder()
                .verb(verb)
                .keyword(keyword)
                .line(line)
                .content(content)
                .operands(CobolText.words(rest));
        if (verb == StatementVerb.IF) {
            builder.conditions(conditions(rest));
        }
        return builder.build();
    }

    /** First relational comparison in the text; compound conditions are not split. */
    private List<Condition> conditions(String text) {
        Matcher matcher = SIMPLE_CONDITION.matcher(text);
        if (!matcher.find()) {
            return List.of();
        }
        String operator = NOT_EQUAL.matcher(matcher.group(2)).matches() ? "NOT =" : matcher.group(2);
        return List.of(Condition.builder()
                .type(ConditionType.SIMPLE)
                .operand1(matcher.group(1))
                .operator(operator)
                .operand2(CobolText.stripTrailingPeriod(matcher.group(3)))
                .build());
    }
}
