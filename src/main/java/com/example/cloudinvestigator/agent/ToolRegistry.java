package com.example.cloudinvestigator.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of the tools this service exposes, keyed by name.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    public void register(AgentTool tool) {
        AgentTool previous = tools.put(tool.getName(), tool);
        if (previous != null && previous != tool) {
            log.warn("Tool {} re-registered, replacing {}", tool.getName(), previous.getClass().getSimpleName());
        }
        log.info("Registered tool: {} ({})", tool.getName(), tool.getCategory());
    }

    public Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Name, category, description, mutating flag and parameter schema of each tool.
     */
    public List<Map<String, Object>> listToolsDetailed() {
        return tools.values().stream()
                .sorted(Comparator.comparing(AgentTool::getCategory).thenComparing(AgentTool::getName))
                .map(tool -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", tool.getName());
                    info.put("category", tool.getCategory());
                    info.put("description", tool.getDescription());
                    info.put("is_mutating", tool.isMutating());
                    info.put("parameters", tool.getParameterSchema());
                    return info;
                })
                .collect(Collectors.toList());
    }

    public int getToolCount() {
        return tools.size();
    }
}
