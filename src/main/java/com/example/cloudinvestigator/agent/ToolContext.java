package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.domain.Deadline;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call context handed to a tool.
 */
@Value
@Builder
public class ToolContext {

    String sessionId;

    /** Who triggered the call, for the audit trail */
    String actor;

    @Builder.Default
    Deadline deadline = Deadline.none();
}
