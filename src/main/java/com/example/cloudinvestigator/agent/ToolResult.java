package com.example.cloudinvestigator.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result of a tool call: a JSON-ready payload, or an error message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    @Builder.Default
    private boolean success = true;

    private Map<String, Object> payload;

    private String error;

    /** The parameters were rejected before anything ran */
    private boolean invalidInput;

    public static ToolResult json(Map<String, Object> payload) {
        return ToolResult.builder()
                .success(true)
                .payload(payload)
                .build();
    }

    /**
     * A call that ran but reported failure in its payload.
     */
    public static ToolResult failed(Map<String, Object> payload, String error) {
        return ToolResult.builder()
                .success(false)
                .payload(payload)
                .error(error)
                .build();
    }

    public static ToolResult error(String errorMessage) {
        return ToolResult.builder()
                .success(false)
                .payload(Map.of("success", false, "error", errorMessage))
                .error(errorMessage)
                .invalidInput(true)
                .build();
    }
}
