package io.tempo4j.interaction;

import java.util.Objects;

/**
 * A text message received from a tenant. {@code userId} is the tenant key.
 */
public record InboundMessage(String chatId, String userId, String text) {
    public InboundMessage {
        Objects.requireNonNull(chatId, "chatId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
