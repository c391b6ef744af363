package com.z254.lumina.tutor.domain.model;

/**
 * Delivery priority of a message.
 */
public enum MessagePriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
