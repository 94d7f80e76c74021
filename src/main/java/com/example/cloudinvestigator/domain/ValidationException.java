package com.example.cloudinvestigator.domain;

/**
 * Malformed request or query. Raised before anything is executed or recorded.
 */
public class ValidationException extends InvestigationException {

    public ValidationException(String message) {
        super(message);
    }
}
