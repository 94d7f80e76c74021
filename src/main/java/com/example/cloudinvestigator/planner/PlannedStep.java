package com.example.cloudinvestigator.planner;

/**
 * One step of an investigation plan: what the query answers, and the query.
 */
public record PlannedStep(String description, String query) {
}
