package com.example.cloudinvestigator.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a failed query or step.
 * SCHEMA through UNKNOWN come from classifying executor output. CANCELLED
 * and VALIDATION are assigned by the agent loop.
 */
public enum ErrorType {
    SCHEMA,
    SYNTAX,
    AUTH,
    TIMEOUT,
    UNKNOWN,
    CANCELLED,
    VALIDATION;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorType fromLabel(String label) {
        if (label == null) return UNKNOWN;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
