package io.tempo4j.utils;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 6-field cron expression: {@code second minute hour day month weekday}, parsed by Spring's
 * {@link org.springframework.scheduling.support.CronExpression}.
 *
 * <p>Each field accepts {@code *}, a literal, a range {@code a-b}, a step ({@code *}{@code /N},
 * {@code a-b/N}, {@code a/N}) or a comma-separated list of those. Day and weekday also accept
 * {@code ?}. Months accept {@code jan..dec}; weekdays accept {@code sun..sat}, {@code 0} and {@code 7}
 * both meaning Sunday.
 *
 * <p>When both day and weekday are restricted, a date matches if either matches (classic cron);
 * otherwise both must match. Spring always combines them with AND, so the restricted case is
 * evaluated as two expressions, one per day field, and the earlier match wins.
 *
 * <p>Instances are immutable and compare equal by their normalized text.
 */
public final class CronExpression {

    public static final int FIELD_COUNT = 6;

    private static final List<String> FIELD_NAMES = List.of("second", "minute", "hour", "day", "month", "weekday");
    private static final int DAY = 3;
    private static final int WEEKDAY = 5;

    private final String expression;
    private final List<org.springframework.scheduling.support.CronExpression> alternatives;

    private CronExpression(String expression,
                           List<org.springframework.scheduling.support.CronExpression> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    /**
     * @throws InvalidCronExpressionException with {@code WRONG_ARITY} when the field count is not 6,
     *                                        or {@code UNPARSEABLE_FIELD} naming the bad field
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw InvalidCronExpressionException.wrongArity(String.valueOf(expression), 0);
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw InvalidCronExpressionException.wrongArity(expression, parts.length);
        }
        for (int i = 0; i < FIELD_COUNT; i++) {
            checkField(parts, i);
        }

        String normalized = String.join(" ", parts);
        if (isRestricted(parts[DAY]) && isRestricted(parts[WEEKDAY])) {
            return new CronExpression(normalized, List.of(
                    compile(withField(parts, WEEKDAY, "*")),
                    compile(withField(parts, DAY, "*"))
            ));
        }
        return new CronExpression(normalized, List.of(compile(parts)));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException ex) {
            return false;
        }
    }

    /**
     * Earliest local date-time strictly after {@code after} that matches, rounded to whole seconds.
     *
     * @return the match, or {@code null} if there is none
     */
    public LocalDateTime next(LocalDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        LocalDateTime earliest = null;
        for (org.springframework.scheduling.support.CronExpression alternative : alternatives) {
            LocalDateTime candidate = alternative.next(after);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        return earliest;
    }

    /**
     * Normalized expression text (single spaces between fields).
     */
    public String expression() {
        return expression;
    }

    // Day and weekday are OR-ed only when neither starts with a wildcard.
    private static boolean isRestricted(String field) {
        return !(field.startsWith("*") || field.startsWith("?"));
    }

    /*
     * Parses one field against wildcards in all the others, so a failure can name the field.
     */
    private static void checkField(String[] parts, int index) {
        String[] single = {"0", "0", "0", "*", "*", "*"};
        single[index] = parts[index];
        try {
            org.springframework.scheduling.support.CronExpression.parse(String.join(" ", single));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw InvalidCronExpressionException.unparseableField(FIELD_NAMES.get(index), parts[index], e.getMessage());
        }
    }

    private static String[] withField(String[] parts, int index, String value) {
        String[] copy = parts.clone();
        copy[index] = value;
        return copy;
    }

    private static org.springframework.scheduling.support.CronExpression compile(String[] parts) {
        String text = String.join(" ", parts);
        try {
            return org.springframework.scheduling.support.CronExpression.parse(text);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw InvalidCronExpressionException.unparseableField("expression", text, e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression other)) return false;
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
