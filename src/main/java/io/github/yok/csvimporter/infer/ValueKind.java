package io.github.yok.csvimporter.infer;

/**
 * Kind of a single classified CSV value.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ValueKind {

    // Empty or whitespace-only value
    NULL,

    // true / false / yes / no
    BOOLEAN,

    // Optional sign followed by digits
    INTEGER,

    // Fixed-point literal that fits a double without loss
    FLOAT,

    // Fixed-point literal that needs an exact decimal type
    DECIMAL,

    // Date without time of day
    DATE,

    // Date and time without fractional seconds
    DATETIME,

    // Date and time with fractional seconds
    DATETIME_WITH_FRACTION,

    // Anything else
    TEXT;

    /**
     * Returns whether values of this kind are numbers.
     *
     * @return {@code true} for INTEGER, FLOAT and DECIMAL
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == DECIMAL;
    }

    /**
     * Returns whether values of this kind are dates or timestamps.
     *
     * @return {@code true} for DATE, DATETIME and DATETIME_WITH_FRACTION
     */
    public boolean isTemporal() {
        return this == DATE || this == DATETIME || this == DATETIME_WITH_FRACTION;
    }
}
