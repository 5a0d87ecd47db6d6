package com.legacy.cobol.docs.exception;

import lombok.Getter;

/**
 * Thrown when a graph exceeds a configured ceiling: node and edge counts are checked before
 * any pass runs, the traversal step budget while the max-depth metric is computed.
 */
@Getter
public class GraphLimitExceededException extends RuntimeException {

    private final String limit;
    private final int actual;
    private final int maximum;

    public GraphLimitExceededException(String limit, int actual, int maximum) {
        super(String.format("Graph %s limit exceeded: %d > %d", limit, actual, maximum));
        this.limit = limit;
        this.actual = actual;
        this.maximum = maximum;
    }
}
