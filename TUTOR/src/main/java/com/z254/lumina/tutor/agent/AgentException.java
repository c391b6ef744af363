package com.z254.lumina.tutor.agent;

import com.z254.lumina.tutor.client.McpServiceException;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import lombok.Getter;

import java.util.concurrent.TimeoutException;

/**
 * Typed agent failure.
 */
@Getter
public class AgentException extends RuntimeException {

    private final ErrorCode code;
    private final AgentType agentType;
    private final String messageId;

    public AgentException(ErrorCode code, AgentType agentType, String messageId, String message) {
        this(code, agentType, messageId, message, null);
    }

    public AgentException(ErrorCode code, AgentType agentType, String messageId, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.agentType = agentType;
        this.messageId = messageId;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    /**
     * Classify an arbitrary failure raised while handling a message.
     */
    public static AgentException from(Throwable error, AgentType agentType, String messageId) {
        if (error instanceof AgentException agentException) {
            return agentException;
        }
        if (error instanceof TimeoutException) {
            return new AgentException(ErrorCode.TIMEOUT, agentType, messageId,
                    agentType + " timed out handling " + messageId, error);
        }
        if (error instanceof McpServiceException) {
            return new AgentException(ErrorCode.SERVICE_CONNECTION_FAILED, agentType, messageId,
                    error.getMessage(), error);
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new AgentException(ErrorCode.PROCESSING_ERROR, agentType, messageId, detail, error);
    }
}
