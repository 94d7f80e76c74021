package com.example.cloudinvestigator.tools;

import com.example.cloudinvestigator.agent.AgentTool;
import com.example.cloudinvestigator.agent.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers every {@link AgentTool} bean once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolRegistrationConfig {

    private final ToolRegistry toolRegistry;
    private final List<AgentTool> allTools;

    @EventListener(ApplicationReadyEvent.class)
    public void registerTools() {
        allTools.forEach(toolRegistry::register);
        log.info("Tool registration complete. {} tool(s) available", toolRegistry.getToolCount());
    }
}
