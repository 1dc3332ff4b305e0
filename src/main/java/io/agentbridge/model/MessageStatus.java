package io.agentbridge.model;

/**
 * Delivery state of a message. The only transition is {@code SENT -> ACKNOWLEDGED}.
 */
public enum MessageStatus {
    SENT,
    ACKNOWLEDGED
}
