package com.example.cloudinvestigator.query;

import org.springframework.stereotype.Component;

/**
 * Maps raw executor error text to an {@link ErrorType}.
 * Checks run in order and the first match wins. Matching is case-sensitive,
 * as in {@link LessonGenerator}.
 */
@Component
public class ErrorClassifier {

    public ErrorType classify(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return ErrorType.UNKNOWN;
        }
        if (errorMessage.contains("column") && errorMessage.contains("does not exist")) {
            return ErrorType.SCHEMA;
        }
        if (errorMessage.contains("syntax")) {
            return ErrorType.SYNTAX;
        }
        if (errorMessage.contains("authentication") || errorMessage.contains("access")) {
            return ErrorType.AUTH;
        }
        if (errorMessage.contains("timeout")) {
            return ErrorType.TIMEOUT;
        }
        return ErrorType.UNKNOWN;
    }
}
