package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;

import java.util.Map;

/**
 * Request dispatched to an agent as part of an execution plan stage. Carries the results of
 * the stages that already settled.
 */
public interface StageRequest extends AgentPayload {

    String query();

    ProcessedQuery processedQuery();

    ConversationContext context();

    Map<AgentType, AgentContribution> previousResults();
}
