package com.example.cloudinvestigator.planner;

import com.example.cloudinvestigator.domain.Deadline;
import com.example.cloudinvestigator.domain.InvestigationStep;
import com.example.cloudinvestigator.domain.Provider;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an enhanced prompt into an ordered query plan.
 */
public interface Planner {

    /**
     * @return the planned steps, in execution order
     * @throws PlannerException on transport, auth or parse failure
     */
    List<PlannedStep> generatePlan(String enhancedPrompt, Provider provider,
                                   Set<String> candidateTables, Deadline deadline);

    /**
     * Narrative summary of finished steps. Planners that cannot summarize
     * return empty and the agent composes a summary itself.
     */
    default Optional<String> summarize(String prompt, Provider provider,
                                       List<InvestigationStep> steps, Deadline deadline) {
        return Optional.empty();
    }
}
