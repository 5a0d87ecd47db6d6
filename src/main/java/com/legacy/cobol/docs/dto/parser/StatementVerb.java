package com.legacy.cobol.docs.dto.parser;

import java.util.Locale;

/**
 * Procedure statement vocabulary. Anything else, including continuation lines, is {@link #OTHER}.
 */
public enum StatementVerb {
    MOVE, COMPUTE, ADD, SUBTRACT, MULTIPLY, DIVIDE,
    IF, EVALUATE, PERFORM, CALL, GOTO, STOP, GOBACK,
    OPEN, CLOSE, READ, WRITE, REWRITE, DELETE, START,
    DISPLAY, ACCEPT, INSPECT, STRING, UNSTRING,
    SEARCH, SORT, MERGE, RELEASE, RETURN, COPY, REPLACE,
    EXIT, CONTINUE, NEXT, INITIALIZE, SET, EXEC,
    OTHER;

    public static StatementVerb fromKeyword(String keyword) {
        if (keyword == null || keyword.isEmpty()) return OTHER;
        String upper = keyword.toUpperCase(Locale.ROOT);
        if ("GO".equals(upper) || "GO-TO".equals(upper)) return GOTO;
        try {
            return valueOf(upper);
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    public static boolean isVerb(String keyword) {
        return fromKeyword(keyword) != OTHER;
    }
}
