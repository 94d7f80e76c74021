package com.example.cloudinvestigator.domain;

/**
 * Base type for errors that terminate an investigation and reach the caller.
 */
public class InvestigationException extends RuntimeException {

    public InvestigationException(String message) {
        super(message);
    }

    public InvestigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
