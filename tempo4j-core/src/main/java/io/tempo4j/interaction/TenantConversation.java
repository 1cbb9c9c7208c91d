package io.tempo4j.interaction;

import java.time.Duration;
import java.util.Objects;

/**
 * One tenant's chat, as seen from a background task.
 */
public class TenantConversation {

    private final InteractionBridge bridge;
    private final ChatTransport transport;
    private final String tenantId;
    private final String chatId;
    private final boolean interactive;

    public TenantConversation(InteractionBridge bridge, ChatTransport transport, String tenantId, String chatId,
                              boolean interactive) {
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.chatId = Objects.requireNonNull(chatId, "chatId must not be null");
        this.interactive = interactive;
    }

    public String tenantId() {
        return tenantId;
    }

    public String chatId() {
        return chatId;
    }

    /**
     * Whether {@link #ask} may be used. Non-interactive tasks must decide on their own.
     */
    public boolean isInteractive() {
        return interactive;
    }

    public void send(String text) {
        transport.sendMessage(chatId, text);
    }

    public String ask(String question) throws InterruptedException {
        requireInteractive();
        return bridge.ask(tenantId, chatId, question);
    }

    public String ask(String question, Duration timeout) throws InterruptedException {
        requireInteractive();
        return bridge.ask(tenantId, chatId, question, timeout);
    }

    private void requireInteractive() {
        if (!interactive) {
            throw new IllegalStateException("Conversation with tenant " + tenantId + " is not interactive");
        }
    }
}
