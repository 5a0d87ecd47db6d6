package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.IssueSeverity;
import com.legacy.cobol.docs.dto.parser.ParseIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of a single parse: the forward cursor divisions are searched from and the
 * diagnostics collected so far. One instance per parse call.
 */
final class ParseContext {

    private int cursor;
    private final List<ParseIssue> errors = new ArrayList<>();
    private final List<ParseIssue> warnings = new ArrayList<>();

    int cursor() {
        return cursor;
    }

    void moveCursor(int index) {
        this.cursor = index;
    }

    void error(int line, int column, String message, String code) {
        errors.add(ParseIssue.builder()
                .line(line)
                .column(column)
                .message(message)
                .severity(IssueSeverity.ERROR)
                .code(code)
                .build());
    }

    void warning(int line, int column, String message, String code) {
        warnings.add(ParseIssue.builder()
                .line(line)
                .column(column)
                .message(message)
                .severity(IssueSeverity.WARNING)
                .code(code)
                .build());
    }

    List<ParseIssue> errors() {
        return List.copyOf(errors);
    }

    List<ParseIssue> warnings() {
        return List.copyOf(warnings);
    }
}
