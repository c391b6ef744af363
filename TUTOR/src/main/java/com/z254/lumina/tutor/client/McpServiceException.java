package com.z254.lumina.tutor.client;

import lombok.Getter;

/**
 * Failure talking to the MCP service layer.
 */
@Getter
public class McpServiceException extends RuntimeException {

    private final String code;

    public McpServiceException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
