package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentState;

public record Heartbeat(AgentState state, long messageCount, long errorCount) implements AgentPayload {

    @Override
    public Operation operation() {
        return Operation.HEARTBEAT;
    }
}
