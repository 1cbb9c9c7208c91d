package io.tempo4j.utils;

import io.tempo4j.core.ScheduleSpec;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next fire instant of a {@link ScheduleSpec}.
 *
 * <p>Cron specs are matched against local wall-clock fields in the spec's zone:
 * <ul>
 *   <li>a local time inside a DST gap does not exist and is skipped</li>
 *   <li>a local time that occurs twice (DST overlap) fires on its first occurrence only</li>
 *   <li>the search stops after {@code horizon}; a spec with no match inside it never fires</li>
 * </ul>
 */
public final class TriggerEvaluator {

    public static final Period DEFAULT_HORIZON = Period.ofYears(5);

    private final Period horizon;

    public TriggerEvaluator() {
        this(DEFAULT_HORIZON);
    }

    public TriggerEvaluator(Period horizon) {
        Objects.requireNonNull(horizon, "horizon must not be null");
        if (horizon.isZero() || horizon.isNegative()) {
            throw new IllegalArgumentException("horizon must be positive");
        }
        this.horizon = horizon;
    }

    /**
     * @return the earliest fire instant strictly after {@code after}, or empty if the spec never
     * fires again
     */
    public Optional<Instant> nextFireAfter(ScheduleSpec spec, Instant after) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(after, "after must not be null");

        if (spec instanceof ScheduleSpec.FixedInstant fixed) {
            return after.isBefore(fixed.fireAt()) ? Optional.of(fixed.fireAt()) : Optional.empty();
        }
        if (spec instanceof ScheduleSpec.Cron cron) {
            return nextCronFire(cron, after);
        }
        throw new IllegalArgumentException("Unsupported schedule spec: " + spec.getClass().getName());
    }

    private Optional<Instant> nextCronFire(ScheduleSpec.Cron cron, Instant after) {
        Instant validUntil = cron.validUntil();
        if (validUntil != null && !after.isBefore(validUntil)) {
            return Optional.empty();
        }

        Instant floor = after;
        if (cron.validFrom() != null && cron.validFrom().isAfter(after)) {
            floor = cron.validFrom().minusNanos(1);
        }

        ZoneRules rules = cron.zone().getRules();
        LocalDateTime cursor = LocalDateTime.ofInstant(floor, cron.zone());
        LocalDate lastDate = cursor.toLocalDate().plus(horizon);
        CronExpression expr = cron.expression();

        while (true) {
            LocalDateTime next = expr.next(cursor);
            if (next == null || next.toLocalDate().isAfter(lastDate)) {
                return Optional.empty();
            }
            // Local times repeated by an overlap resolve to an instant at or before floor.
            Instant candidate = firstOccurrence(next, rules);
            if (candidate != null && candidate.isAfter(floor)) {
                if (validUntil != null && !candidate.isBefore(validUntil)) {
                    return Optional.empty();
                }
                return Optional.of(candidate);
            }
            cursor = next;
        }
    }

    private static Instant firstOccurrence(LocalDateTime local, ZoneRules rules) {
        ZoneOffsetTransition transition = rules.getTransition(local);
        ZoneOffset offset;
        if (transition == null) {
            offset = rules.getOffset(local);
        } else if (transition.isGap()) {
            return null;
        } else {
            offset = transition.getOffsetBefore();
        }
        return local.toInstant(offset);
    }
}
