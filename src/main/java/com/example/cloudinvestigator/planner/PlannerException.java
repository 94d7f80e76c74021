package com.example.cloudinvestigator.planner;

import com.example.cloudinvestigator.domain.InvestigationException;

/**
 * The planner could not produce a usable plan (transport, auth or parse failure).
 */
public class PlannerException extends InvestigationException {

    public PlannerException(String message) {
        super(message);
    }

    public PlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
