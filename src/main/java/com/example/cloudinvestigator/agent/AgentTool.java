package com.example.cloudinvestigator.agent;

import java.util.Map;

/**
 * A capability callable by name with JSON-like parameters.
 * Tools are registered in the {@link ToolRegistry} at startup and can be
 * invoked over HTTP or by an LLM-driven caller.
 */
public interface AgentTool {

    /**
     * Unique tool name (e.g. "steampipe_query").
     */
    String getName();

    /**
     * Human-readable description, also used as LLM guidance.
     */
    String getDescription();

    String getCategory();

    /**
     * JSON Schema describing the accepted parameters.
     */
    Map<String, Object> getParameterSchema();

    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    /**
     * Whether this tool can modify cloud state.
     */
    default boolean isMutating() {
        return false;
    }
}
