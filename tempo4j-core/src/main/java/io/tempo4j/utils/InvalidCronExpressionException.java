package io.tempo4j.utils;

/**
 * A cron expression was rejected before anything was persisted.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {

    public enum Reason {
        /**
         * The expression does not have exactly six fields.
         */
        WRONG_ARITY,
        /**
         * One of the six fields could not be parsed.
         */
        UNPARSEABLE_FIELD
    }

    private final Reason reason;
    private final String field;

    private InvalidCronExpressionException(Reason reason, String field, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
    }

    static InvalidCronExpressionException wrongArity(String expression, int fieldCount) {
        return new InvalidCronExpressionException(Reason.WRONG_ARITY, null,
                "Cron expression must have exactly 6 fields (second minute hour day month weekday) but had "
                        + fieldCount + ": '" + expression + "'");
    }

    static InvalidCronExpressionException unparseableField(String fieldName, String fieldText, String detail) {
        return new InvalidCronExpressionException(Reason.UNPARSEABLE_FIELD, fieldName,
                "Unparseable " + fieldName + " field '" + fieldText + "': " + detail);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Name of the offending field, or {@code null} for {@link Reason#WRONG_ARITY}.
     */
    public String field() {
        return field;
    }
}
