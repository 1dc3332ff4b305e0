package io.agentbridge.model;

import io.agentbridge.error.ValidationException;

import java.util.Locale;

public enum MessageType {
    TASK_DELEGATION,
    TASK_ACCEPTED,
    PROGRESS_UPDATE,
    TASK_COMPLETED,
    TASK_DELIVERABLES,
    TASK_FAILED,
    BLOCKER_REPORT,
    REQUEST_FOR_INFO,
    STRATEGIC_QUERY,
    STATUS_REQUEST,
    STATUS_RESPONSE,
    ANNOUNCEMENT,
    ERROR_NOTIFICATION,
    BUSINESS_IMPACT_REPORT;

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Message type is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (MessageType value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new ValidationException("Invalid message type: " + raw);
    }
}
