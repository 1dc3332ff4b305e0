package io.agentbridge.a2a;

import io.agentbridge.model.Message;
import io.agentbridge.model.MessageType;

/**
 * Subscription predicate. Null fields match anything.
 */
public record MessageFilter(String recipient, MessageType type, String contextId) {
    public static MessageFilter forRecipient(String recipient) {
        return new MessageFilter(recipient, null, null);
    }

    public static MessageFilter forContext(String contextId) {
        return new MessageFilter(null, null, contextId);
    }

    public boolean matches(Message message) {
        if (message == null) {
            return false;
        }
        if (recipient != null && !recipient.equals(message.recipient())) {
            return false;
        }
        if (type != null && type != message.type()) {
            return false;
        }
        return contextId == null || contextId.equals(message.contextId());
    }
}
