package io.tempo4j.handlers;

/**
 * Payload of a reminder job. {@code chatId} defaults to the job owner when absent.
 */
public record ReminderData(String message, String chatId) {
}
