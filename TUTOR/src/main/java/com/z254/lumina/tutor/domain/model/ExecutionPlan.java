package com.z254.lumina.tutor.domain.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered stages of agent calls for one query. Members of a stage run concurrently; a stage
 * starts only after the previous one has settled.
 */
public record ExecutionPlan(String requestId, List<Set<AgentType>> stages) {

    public ExecutionPlan {
        List<Set<AgentType>> copy = new ArrayList<>();
        for (Set<AgentType> stage : stages) {
            if (!stage.isEmpty()) {
                copy.add(Set.copyOf(stage));
            }
        }
        stages = List.copyOf(copy);
    }

    /**
     * Fixed three-stage shape: conversation and content first, then the visual, assessment and
     * resource agents, then pedagogy. Agents not in {@code required} are left out.
     */
    public static ExecutionPlan forAgents(String requestId, Set<AgentType> required) {
        Set<AgentType> stage1 = EnumSet.of(AgentType.CONVERSATION);
        if (required.contains(AgentType.CONTENT_SPECIALIST)) {
            stage1.add(AgentType.CONTENT_SPECIALIST);
        }

        Set<AgentType> stage2 = EnumSet.noneOf(AgentType.class);
        for (AgentType type : List.of(AgentType.VISUAL_LEARNING, AgentType.ASSESSMENT, AgentType.RESOURCE)) {
            if (required.contains(type)) {
                stage2.add(type);
            }
        }

        Set<AgentType> stage3 = EnumSet.noneOf(AgentType.class);
        if (required.contains(AgentType.PEDAGOGY)) {
            stage3.add(AgentType.PEDAGOGY);
        }

        return new ExecutionPlan(requestId, List.of(stage1, stage2, stage3));
    }

    public Set<AgentType> allAgents() {
        Set<AgentType> all = new LinkedHashSet<>();
        stages.forEach(all::addAll);
        return all;
    }
}
