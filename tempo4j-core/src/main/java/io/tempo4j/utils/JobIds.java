package io.tempo4j.utils;

import java.time.Instant;
import java.util.Objects;

/**
 * Deterministic job ids, so re-creating "the same" schedule replaces it instead of duplicating it.
 *
 * <ul>
 *   <li>cron: {@code <kind>_<chatId>_<fields joined by '_'>}, e.g. {@code reminder_42_0_0_9_*_*_*}</li>
 *   <li>one-shot: {@code <kind>_<chatId>_at_<epochSecond>}</li>
 * </ul>
 */
public final class JobIds {
    private JobIds() {
    }

    public static String forCron(String kind, String chatId, String cronExpression) {
        Objects.requireNonNull(cronExpression, "cronExpression must not be null");
        return prefix(kind, chatId) + cronExpression.trim().replaceAll("\\s+", "_");
    }

    public static String forInstant(String kind, String chatId, Instant fireAt) {
        Objects.requireNonNull(fireAt, "fireAt must not be null");
        return prefix(kind, chatId) + "at_" + fireAt.getEpochSecond();
    }

    private static String prefix(String kind, String chatId) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        if (chatId == null || chatId.isBlank()) {
            throw new IllegalArgumentException("chatId must not be blank");
        }
        return kind + "_" + chatId + "_";
    }
}
