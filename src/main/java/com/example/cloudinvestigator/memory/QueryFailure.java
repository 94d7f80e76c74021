package com.example.cloudinvestigator.memory;

import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.query.ErrorType;

import java.time.Instant;

/**
 * A failed query together with the lesson drawn from it.
 */
public record QueryFailure(
        String originalIntent,
        String generatedQuery,
        String errorMessage,
        ErrorType errorType,
        Provider provider,
        Instant timestamp,
        String lessonLearned) {
}
