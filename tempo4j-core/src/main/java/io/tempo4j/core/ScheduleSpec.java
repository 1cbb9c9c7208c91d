package io.tempo4j.core;

import io.tempo4j.utils.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * When a job fires.
 *
 * <p>Two shapes exist:
 * <ul>
 *   <li>{@link FixedInstant}: a single run at an absolute instant</li>
 *   <li>{@link Cron}: a recurring 6-field cron pattern evaluated in a time zone, optionally bounded
 *       by a validity window</li>
 * </ul>
 *
 * <p>Instants are truncated to whole milliseconds.
 */
public interface ScheduleSpec {

    ZoneId zone();

    static FixedInstant at(Instant fireAt, ZoneId zone) {
        return new FixedInstant(fireAt, zone);
    }

    static Cron cron(CronExpression expression, ZoneId zone) {
        return new Cron(expression, zone, null, null);
    }

    record FixedInstant(Instant fireAt, ZoneId zone) implements ScheduleSpec {
        public FixedInstant {
            Objects.requireNonNull(fireAt, "fireAt must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
            fireAt = fireAt.truncatedTo(ChronoUnit.MILLIS);
        }
    }

    /**
     * Recurring schedule. {@code validFrom} and {@code validUntil} are optional; when both are set,
     * {@code validUntil} must be after {@code validFrom}.
     */
    record Cron(CronExpression expression, ZoneId zone, Instant validFrom, Instant validUntil)
            implements ScheduleSpec {
        public Cron {
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
            validFrom = validFrom == null ? null : validFrom.truncatedTo(ChronoUnit.MILLIS);
            validUntil = validUntil == null ? null : validUntil.truncatedTo(ChronoUnit.MILLIS);
            if (validFrom != null && validUntil != null && !validUntil.isAfter(validFrom)) {
                throw new IllegalArgumentException("validUntil must be after validFrom");
            }
        }

        public Cron withWindow(Instant validFrom, Instant validUntil) {
            return new Cron(expression, zone, validFrom, validUntil);
        }
    }
}
