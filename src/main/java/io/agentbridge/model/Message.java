package io.agentbridge.model;

import java.util.Map;

public record Message(
        String id,
        long seq,
        String sender,
        String recipient,
        MessageType type,
        Map<String, Object> payload,
        String contextId,
        MessageStatus status,
        long createdAtMs,
        String acknowledgedBy,
        Long acknowledgedAtMs,
        long updatedAtMs
) {
    public static final String BROADCAST_RECIPIENT = "All";

    public Message {
        payload = payload == null ? Map.of() : payload;
    }

    public boolean acknowledged() {
        return status == MessageStatus.ACKNOWLEDGED;
    }
}
