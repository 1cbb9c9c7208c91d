package io.tempo4j.core;

/**
 * Immutable job definition produced by {@code JobBuilder.build()}.
 * This is a pure data object with no persistence logic.
 */
public record JobRequest<T>(
        String id,
        String ownerId,
        String handlerKind,
        ScheduleSpec spec,
        T payload
) {
}
