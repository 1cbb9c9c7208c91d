package io.tempo4j.core;

/**
 * Outcome of an upsert keyed by id: exactly one of {@code created} and {@code replaced} is set.
 */
public record PersistResult(
        boolean created,
        boolean replaced
) {
    public static PersistResult createdResult() {
        return new PersistResult(true, false);
    }

    public static PersistResult replacedResult() {
        return new PersistResult(false, true);
    }

    public static PersistResult of(boolean inserted) {
        return inserted ? createdResult() : replacedResult();
    }
}
