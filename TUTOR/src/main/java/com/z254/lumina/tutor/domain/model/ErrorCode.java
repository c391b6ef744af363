package com.z254.lumina.tutor.domain.model;

/**
 * Failure taxonomy shared by agents, the orchestrator and error payloads.
 */
public enum ErrorCode {

    /**
     * Malformed envelope: missing id, timestamp, sender, type or payload.
     */
    INVALID_MESSAGE(false),

    /**
     * The agent cannot handle the payload operation or message type.
     */
    UNSUPPORTED_OPERATION(false),

    /**
     * Generic failure while processing.
     */
    PROCESSING_ERROR(true),

    /**
     * The allotted time was exceeded.
     */
    TIMEOUT(true),

    /**
     * An external collaborator was unreachable.
     */
    SERVICE_CONNECTION_FAILED(true),

    /**
     * The conversation agent failed, so the query cannot be answered.
     */
    CRITICAL_PATH_FAILURE(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
