package com.legacy.cobol.docs.exception;

public class PathNotFoundException extends RuntimeException {

    public PathNotFoundException(String from, String to) {
        super("No dependency path between " + from + " and " + to);
    }
}
