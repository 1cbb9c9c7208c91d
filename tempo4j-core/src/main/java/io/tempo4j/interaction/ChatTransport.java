package io.tempo4j.interaction;

/**
 * Outbound side of the chat integration. Implemented by the host application (Telegram, webhook, ...).
 */
public interface ChatTransport {

    /**
     * Publish {@code text} to the given chat. Implementations throw on delivery failure.
     */
    void sendMessage(String chatId, String text);
}
