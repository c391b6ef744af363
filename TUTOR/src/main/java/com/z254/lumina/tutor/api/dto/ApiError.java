package com.z254.lumina.tutor.api.dto;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 */
public record ApiError(int status, String error, String message, String path, Instant timestamp) {
}
