package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.agent.AgentMetrics;
import com.z254.lumina.tutor.domain.model.AgentState;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.TutorResponse;
import com.z254.lumina.tutor.domain.payload.LearningEventNotification;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point for student queries. Coordinates the agents in staged fan-out / fan-in and merges
 * their results into one response.
 */
public interface TutorOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Query processing
    // --------------------------------------------------------------------------------------------

    /**
     * Answer a student query. Never fails: unrecoverable problems yield the degraded response.
     *
     * @param text    the student's question
     * @param context session, learner and preferences
     * @return the merged response
     */
    Mono<TutorResponse> processQuery(String text, ConversationContext context);

    /**
     * Handle a learning event (milestone reached, concept mastered, session completed).
     */
    Mono<Void> publishLearningEvent(LearningEventNotification event);

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    /**
     * Install routing rules, subscribe to the bus and initialize every registered agent.
     * Agents that fail to initialize are logged and left uninitialized.
     */
    Mono<Void> start();

    void shutdown();

    boolean isStarted();

    /**
     * Poll the service layer and every agent once. Never removes or restarts agents.
     */
    Mono<Void> runHealthSweep();

    // --------------------------------------------------------------------------------------------
    // Status
    // --------------------------------------------------------------------------------------------

    List<AgentStatus> getAgentStatuses();

    Map<String, Object> getStats();

    /**
     * Point-in-time view of one agent.
     *
     * @param lastHeartbeat time of the last heartbeat received, or {@code null}
     */
    record AgentStatus(AgentType agentType, AgentState state, AgentMetrics.Snapshot metrics,
                       Instant lastHeartbeat) {
    }
}
