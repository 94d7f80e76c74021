package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.example.cloudinvestigator.domain.InvestigationRequest;
import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.memory.AgentMemory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Builds the planner prompt from the user's question and what memory has
 * learned from earlier failures.
 */
@Component
@RequiredArgsConstructor
public class PromptEnhancer {

    static final String KNOWN_ISSUES_HEADER = "KNOWN ISSUES TO AVOID:";

    private final InvestigatorProperties properties;

    public String enhance(InvestigationRequest request, AgentMemory memory) {
        return enhance(request, memory, List.of(), "");
    }

    /**
     * @param candidateTables tables suggested to the planner, may be empty
     * @param schemaContext   rendered table schemas, may be blank
     */
    public String enhance(InvestigationRequest request, AgentMemory memory,
                          Collection<String> candidateTables, String schemaContext) {
        Provider provider = Provider.fromId(request.getProvider())
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + request.getProvider()));

        StringBuilder sb = new StringBuilder();
        sb.append(request.getPrompt().trim()).append("\n\n");
        sb.append("TARGET PROVIDER: ").append(provider.getId()).append("\n");
        if (request.getRegion() != null && !request.getRegion().isBlank()) {
            sb.append("REGION: ").append(request.getRegion().trim()).append("\n");
        }
        if (candidateTables != null && !candidateTables.isEmpty()) {
            sb.append("CANDIDATE TABLES: ").append(String.join(", ", candidateTables)).append("\n");
        }
        if (schemaContext != null && !schemaContext.isBlank()) {
            sb.append("\n").append(schemaContext.trim()).append("\n");
        }

        List<String> lessons = memory.recentLessons(properties.getMemory().getMaxLessons());
        if (!lessons.isEmpty()) {
            sb.append("\n").append(KNOWN_ISSUES_HEADER).append("\n");
            for (String lesson : lessons) {
                sb.append("- ").append(lesson).append("\n");
            }
        }
        return sb.toString();
    }
}
