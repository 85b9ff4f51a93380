package io.github.yok.csvimporter.infer;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Accumulates the {@link ClassificationHint}s of one column over the sample.
 *
 * <p>
 * An observation is mutable only while sampling. After {@link #freeze()} any further
 * {@link #accept(ClassificationHint)} fails, so the reduced type cannot drift from what was
 * observed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ColumnObservation {

    // Source column name
    private final String columnName;

    @Getter(AccessLevel.NONE)
    private final Map<ValueKind, Integer> counts = new EnumMap<>(ValueKind.class);

    // Smallest and largest integer literal seen (null until an integer is seen)
    private BigInteger minInteger;
    private BigInteger maxInteger;

    // Widest integer part and scale seen over all numeric values
    private int maxIntegerDigits;
    private int maxScale;

    // Longest raw value seen, in characters
    private int maxLength;

    // Longest whitespace-only value seen, in characters
    private int maxBlankLength;

    // An empty value was seen
    private boolean nullSeen;

    // An integer other than 0/1 was seen
    private boolean nonBooleanIntegerSeen;

    // A value contradicted the kind family established by earlier values
    private boolean hypothesisBroken;

    private boolean frozen;

    /**
     * Creates an empty observation.
     *
     * @param columnName source column name
     */
    public ColumnObservation(String columnName) {
        this.columnName = columnName;
    }

    /**
     * Folds one value hint into this observation.
     *
     * @param hint hint for one value of this column
     * @throws IllegalStateException if the observation has been frozen
     */
    public void accept(ClassificationHint hint) {
        Preconditions.checkState(!frozen, "observation of column '%s' is frozen", columnName);
        ValueKind kind = hint.getKind();
        if (kind == ValueKind.NULL) {
            nullSeen = true;
            maxBlankLength = Math.max(maxBlankLength, hint.getLength());
            increment(kind);
            return;
        }
        if (!hypothesisBroken && nonNullCount() > 0 && !sameFamilyAsSeen(kind)) {
            hypothesisBroken = true;
        }
        increment(kind);
        maxLength = Math.max(maxLength, hint.getLength());

        if (kind.isNumeric()) {
            maxIntegerDigits = Math.max(maxIntegerDigits, hint.getIntegerDigits());
            maxScale = Math.max(maxScale, hint.getScale());
        }
        if (kind == ValueKind.INTEGER) {
            BigInteger value = hint.getIntegerValue();
            minInteger = minInteger == null ? value : minInteger.min(value);
            maxInteger = maxInteger == null ? value : maxInteger.max(value);
            if (!hint.isBooleanDigit()) {
                nonBooleanIntegerSeen = true;
            }
        }
    }

    /**
     * Ends the sampling pass for this column.
     */
    public void freeze() {
        frozen = true;
    }

    /**
     * Returns how many values of the given kind were seen.
     *
     * @param kind value kind
     * @return count
     */
    public int count(ValueKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    /**
     * Returns the number of non-empty values seen.
     *
     * @return non-null count
     */
    public int nonNullCount() {
        int total = 0;
        for (Map.Entry<ValueKind, Integer> e : counts.entrySet()) {
            if (e.getKey() != ValueKind.NULL) {
                total += e.getValue();
            }
        }
        return total;
    }

    /**
     * Returns whether only the given kinds (plus nulls) were seen.
     *
     * @param kinds permitted kinds
     * @return {@code true} if no other kind occurred
     */
    public boolean onlyKinds(ValueKind... kinds) {
        for (Map.Entry<ValueKind, Integer> e : counts.entrySet()) {
            ValueKind seen = e.getKey();
            if (seen == ValueKind.NULL || e.getValue() == 0) {
                continue;
            }
            boolean permitted = false;
            for (ValueKind k : kinds) {
                permitted |= k == seen;
            }
            if (!permitted) {
                return false;
            }
        }
        return true;
    }

    private void increment(ValueKind kind) {
        counts.merge(kind, 1, Integer::sum);
    }

    private boolean sameFamilyAsSeen(ValueKind kind) {
        if (kind.isNumeric()) {
            return onlyKinds(ValueKind.INTEGER, ValueKind.FLOAT, ValueKind.DECIMAL);
        }
        if (kind.isTemporal()) {
            return onlyKinds(ValueKind.DATE, ValueKind.DATETIME, ValueKind.DATETIME_WITH_FRACTION);
        }
        return onlyKinds(kind);
    }
}
