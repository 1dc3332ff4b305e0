package io.agentbridge.a2a;

import io.agentbridge.model.Message;

import java.util.List;

public record BroadcastOutcome(
        int totalTargets,
        int successful,
        List<Delivery> deliveries
) {
    public record Delivery(String target, boolean success, Message message, String error) {
        static Delivery ok(String target, Message message) {
            return new Delivery(target, true, message, null);
        }

        static Delivery fail(String target, String error) {
            return new Delivery(target, false, null, error);
        }
    }
}
