package io.github.yok.csvimporter.db;

import io.github.yok.csvimporter.infer.TemporalFormats;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.ColumnType;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts raw CSV text into JDBC-bindable values for a column type.
 *
 * <p>
 * Empty values become {@code null}. Whitespace-only values become {@code null} too, except in text
 * columns where they are kept. Numbers and temporal values are trimmed before parsing; text is
 * passed through unchanged. Any value that does not fit its column type is rejected with an
 * {@link IllegalArgumentException} naming the column, which fails the batch it belongs to.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ValueConverter {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0");

    // Bind booleans as 1/0 instead of Boolean
    private final boolean booleanAsNumber;

    /**
     * Creates a converter that binds booleans as {@link Boolean}.
     */
    public ValueConverter() {
        this(false);
    }

    /**
     * Creates a converter.
     *
     * @param booleanAsNumber {@code true} to bind booleans as {@link BigDecimal} one and zero
     */
    public ValueConverter(boolean booleanAsNumber) {
        this.booleanAsNumber = booleanAsNumber;
    }

    /**
     * Converts one row.
     *
     * @param columns target columns, each naming its source column
     * @param row raw row keyed by source column name
     * @return values in column order
     * @throws IllegalArgumentException if a value does not fit its column
     */
    public Object[] convertRow(List<ColumnDefinition> columns, Map<String, String> row) {
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            ColumnDefinition column = columns.get(i);
            String raw = row.get(column.getSourceName());
            try {
                values[i] = convert(raw, column.getType());
            } catch (IllegalArgumentException | ArithmeticException | DateTimeParseException e) {
                throw new IllegalArgumentException("Column '" + column.getName()
                        + "': cannot convert '" + raw + "' to " + column.describeType(), e);
            }
        }
        return values;
    }

    /**
     * Converts one value.
     *
     * @param raw raw CSV text, may be {@code null}
     * @param type target column type
     * @return bindable value, or {@code null}
     * @throws IllegalArgumentException if the value does not fit the type
     */
    public Object convert(String raw, ColumnType type) {
        if (type == null) {
            throw new IllegalArgumentException("column type is unknown");
        }
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (type.isText()) {
            return raw;
        }
        if (raw.isBlank()) {
            return null;
        }
        String value = raw.strip();
        switch (type.getKind()) {
            case BOOLEAN:
                Boolean bool = toBoolean(value);
                if (booleanAsNumber) {
                    return bool ? BigDecimal.ONE : BigDecimal.ZERO;
                }
                return bool;
            case SMALLINT:
                return toNumber(value).shortValueExact();
            case INT:
                return toNumber(value).intValueExact();
            case BIGINT:
                return toNumber(value).longValueExact();
            case FLOAT:
                return toNumber(value).doubleValue();
            case DECIMAL:
                return toNumber(value);
            case DATE:
                return toDate(value);
            case DATETIME:
            case DATETIME_WITH_FRACTION:
                return Timestamp.valueOf(TemporalFormats.parseDateTime(value));
            default:
                throw new IllegalArgumentException("Unsupported column type: " + type);
        }
    }

    private static Boolean toBoolean(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(lower)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + value);
    }

    private static BigDecimal toNumber(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "yes".equals(lower)) {
            return BigDecimal.ONE;
        }
        if ("false".equals(lower) || "no".equals(lower)) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value);
    }

    private static Date toDate(String value) {
        LocalDateTime dateTime = TemporalFormats.parseDateTime(value);
        if (!LocalTime.MIDNIGHT.equals(dateTime.toLocalTime())) {
            throw new IllegalArgumentException("time of day would be lost: " + value);
        }
        return Date.valueOf(dateTime.toLocalDate());
    }
}
