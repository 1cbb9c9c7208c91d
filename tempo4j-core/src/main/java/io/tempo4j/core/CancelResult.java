package io.tempo4j.core;

/**
 * Result of cancelling a schedule on behalf of an owner.
 *
 * <p>{@link Outcome#NOT_OWNER} is kept apart from {@link Outcome#NOT_FOUND} for logging and auditing,
 * but {@link #message()} is the same for both so a caller cannot discover other owners' jobs.
 */
public record CancelResult(Outcome outcome, String jobId) {

    public enum Outcome {
        CANCELLED,
        NOT_FOUND,
        NOT_OWNER
    }

    public static CancelResult cancelled(String jobId) {
        return new CancelResult(Outcome.CANCELLED, jobId);
    }

    public static CancelResult notFound(String jobId) {
        return new CancelResult(Outcome.NOT_FOUND, jobId);
    }

    public static CancelResult notOwner(String jobId) {
        return new CancelResult(Outcome.NOT_OWNER, jobId);
    }

    public boolean hasEffect() {
        return outcome == Outcome.CANCELLED;
    }

    public String message() {
        if (outcome == Outcome.CANCELLED) {
            return "Schedule cancelled (ID: " + jobId + ")";
        }
        return "No schedule found with ID: " + jobId;
    }
}
