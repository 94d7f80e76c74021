package com.example.cloudinvestigator.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-supplied deadline and cancellation signal for one investigation.
 * Passed to every blocking collaborator call (planner, query executor).
 */
public final class Deadline {

    private final Instant expiresAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private Deadline(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public static Deadline none() {
        return new Deadline(null);
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(Instant.now().plus(timeout));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return expiresAt != null && !Instant.now().isBefore(expiresAt);
    }

    /** True once the caller cancelled or the deadline passed. */
    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    /**
     * Milliseconds left before expiry; {@link Long#MAX_VALUE} when unbounded.
     */
    public long remainingMillis() {
        if (expiresAt == null) return Long.MAX_VALUE;
        return Math.max(0, Duration.between(Instant.now(), expiresAt).toMillis());
    }

    /**
     * Remaining time capped at the given ceiling, for collaborators that
     * carry their own timeout.
     */
    public Duration remainingOr(Duration ceiling) {
        return Duration.ofMillis(Math.min(remainingMillis(), ceiling.toMillis()));
    }
}
