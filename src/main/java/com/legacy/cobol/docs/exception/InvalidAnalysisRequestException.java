package com.legacy.cobol.docs.exception;

/**
 * Thrown when the input of a parse or graph analysis cannot be processed at all,
 * e.g. a missing program list, a negative depth or an oversized source text.
 */
public class InvalidAnalysisRequestException extends RuntimeException {

    public InvalidAnalysisRequestException(String message) {
        super(message);
    }
}
