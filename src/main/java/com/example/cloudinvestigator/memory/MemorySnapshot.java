package com.example.cloudinvestigator.memory;

import java.util.List;

/**
 * Serializable copy of {@link AgentMemory}, used for the optional on-disk store.
 */
public record MemorySnapshot(
        List<QuerySuccess> successes,
        List<QueryFailure> failures,
        List<QueryPattern> patterns) {

    public MemorySnapshot {
        successes = successes != null ? List.copyOf(successes) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
    }
}
