package io.github.yok.csvimporter.schema;

import com.google.common.base.Preconditions;
import java.util.Comparator;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Resolved database-neutral column type.
 *
 * <p>
 * A column type is exactly one {@link Kind} plus the parameters that kind needs: precision and
 * scale for {@link Kind#DECIMAL}, length for {@link Kind#VARCHAR}. Types are totally ordered by
 * widening, first by kind and then by their parameters, so that the wider of two types is always
 * the greater one.
 * </p>
 *
 * <p>
 * Instances are immutable. Use the static factories rather than the constructor.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class ColumnType implements Comparable<ColumnType> {

    /**
     * Maximum decimal precision supported by every target database.
     */
    public static final int MAX_DECIMAL_PRECISION = 38;

    /**
     * Type variants in widening order.
     */
    public enum Kind {
        BOOLEAN, SMALLINT, INT, BIGINT, FLOAT, DECIMAL, DATE, DATETIME, DATETIME_WITH_FRACTION,
        VARCHAR, VARCHAR_MAX
    }

    private static final ColumnType BOOLEAN_TYPE = new ColumnType(Kind.BOOLEAN, 0, 0, 0);
    private static final ColumnType SMALLINT_TYPE = new ColumnType(Kind.SMALLINT, 0, 0, 0);
    private static final ColumnType INT_TYPE = new ColumnType(Kind.INT, 0, 0, 0);
    private static final ColumnType BIGINT_TYPE = new ColumnType(Kind.BIGINT, 0, 0, 0);
    private static final ColumnType FLOAT_TYPE = new ColumnType(Kind.FLOAT, 0, 0, 0);
    private static final ColumnType DATE_TYPE = new ColumnType(Kind.DATE, 0, 0, 0);
    private static final ColumnType DATETIME_TYPE = new ColumnType(Kind.DATETIME, 0, 0, 0);
    private static final ColumnType DATETIME_WITH_FRACTION_TYPE =
            new ColumnType(Kind.DATETIME_WITH_FRACTION, 0, 0, 0);
    private static final ColumnType VARCHAR_MAX_TYPE = new ColumnType(Kind.VARCHAR_MAX, 0, 0, 0);

    private static final Comparator<ColumnType> ORDER = Comparator.comparing(ColumnType::getKind)
            .thenComparingInt(ColumnType::getPrecision).thenComparingInt(ColumnType::getScale)
            .thenComparingInt(ColumnType::getLength);

    private final Kind kind;
    private final int precision;
    private final int scale;
    private final int length;

    private ColumnType(Kind kind, int precision, int scale, int length) {
        this.kind = kind;
        this.precision = precision;
        this.scale = scale;
        this.length = length;
    }

    public static ColumnType booleanType() {
        return BOOLEAN_TYPE;
    }

    public static ColumnType smallInt() {
        return SMALLINT_TYPE;
    }

    public static ColumnType integer() {
        return INT_TYPE;
    }

    public static ColumnType bigInt() {
        return BIGINT_TYPE;
    }

    public static ColumnType floatType() {
        return FLOAT_TYPE;
    }

    /**
     * Returns a fixed-point decimal type.
     *
     * @param precision total number of digits (1..38)
     * @param scale digits after the decimal point (0..precision)
     * @return decimal type
     * @throws IllegalArgumentException if precision or scale are out of range
     */
    public static ColumnType decimal(int precision, int scale) {
        Preconditions.checkArgument(precision >= 1 && precision <= MAX_DECIMAL_PRECISION,
                "precision out of range: %s", precision);
        Preconditions.checkArgument(scale >= 0 && scale <= precision,
                "scale out of range: %s (precision=%s)", scale, precision);
        return new ColumnType(Kind.DECIMAL, precision, scale, 0);
    }

    public static ColumnType date() {
        return DATE_TYPE;
    }

    public static ColumnType dateTime() {
        return DATETIME_TYPE;
    }

    public static ColumnType dateTimeWithFraction() {
        return DATETIME_WITH_FRACTION_TYPE;
    }

    /**
     * Returns a bounded text type.
     *
     * @param length maximum number of characters, positive
     * @return varchar type
     * @throws IllegalArgumentException if {@code length} is not positive
     */
    public static ColumnType varchar(int length) {
        Preconditions.checkArgument(length > 0, "length must be positive: %s", length);
        return new ColumnType(Kind.VARCHAR, 0, 0, length);
    }

    public static ColumnType varcharMax() {
        return VARCHAR_MAX_TYPE;
    }

    /**
     * Returns whether this type is one of the integer kinds.
     *
     * @return {@code true} for SMALLINT, INT and BIGINT
     */
    public boolean isInteger() {
        return kind == Kind.SMALLINT || kind == Kind.INT || kind == Kind.BIGINT;
    }

    /**
     * Returns whether this type is temporal.
     *
     * @return {@code true} for DATE, DATETIME and DATETIME_WITH_FRACTION
     */
    public boolean isTemporal() {
        return kind == Kind.DATE || kind == Kind.DATETIME || kind == Kind.DATETIME_WITH_FRACTION;
    }

    /**
     * Returns whether this type holds text.
     *
     * @return {@code true} for VARCHAR and VARCHAR_MAX
     */
    public boolean isText() {
        return kind == Kind.VARCHAR || kind == Kind.VARCHAR_MAX;
    }

    /**
     * Number of decimal digits before the point that values of this type may need.
     *
     * @return integer digits; {@code 0} for non-numeric kinds
     */
    public int integerDigits() {
        switch (kind) {
            case BOOLEAN:
                return 1;
            case SMALLINT:
                return 5;
            case INT:
                return 10;
            case BIGINT:
                return 19;
            case DECIMAL:
                return precision - scale;
            default:
                return 0;
        }
    }

    /**
     * Maximum number of characters needed to write any value of this type as text.
     *
     * @return display width; {@link Integer#MAX_VALUE} for VARCHAR_MAX
     */
    public int displayWidth() {
        switch (kind) {
            case BOOLEAN:
                return 5;
            case SMALLINT:
                return 6;
            case INT:
                return 11;
            case BIGINT:
                return 20;
            case FLOAT:
                return 24;
            case DECIMAL:
                return precision + 2;
            case DATE:
                return 10;
            case DATETIME:
                return 19;
            case DATETIME_WITH_FRACTION:
                return 29;
            case VARCHAR:
                return length;
            default:
                return Integer.MAX_VALUE;
        }
    }

    /**
     * Returns whether every value of this type can be stored in {@code target} without narrowing.
     *
     * @param target destination column type
     * @return {@code true} if the conversion is lossless
     */
    public boolean isRepresentableIn(ColumnType target) {
        if (target.kind == Kind.VARCHAR_MAX) {
            return true;
        }
        if (target.kind == Kind.VARCHAR) {
            return displayWidth() <= target.length;
        }
        switch (kind) {
            case BOOLEAN:
                return target.kind == Kind.BOOLEAN || target.isInteger()
                        || target.kind == Kind.DECIMAL && target.integerDigits() >= 1;
            case SMALLINT:
            case INT:
                return target.isInteger() && target.integerDigits() >= integerDigits()
                        || target.kind == Kind.DECIMAL && target.integerDigits() >= integerDigits()
                        || target.kind == Kind.FLOAT;
            case BIGINT:
                return target.kind == Kind.BIGINT
                        || target.kind == Kind.DECIMAL && target.integerDigits() >= 19;
            case FLOAT:
                return target.kind == Kind.FLOAT;
            case DECIMAL:
                return target.kind == Kind.DECIMAL && target.integerDigits() >= integerDigits()
                        && target.scale >= scale;
            case DATE:
                return target.isTemporal();
            case DATETIME:
                return target.kind == Kind.DATETIME
                        || target.kind == Kind.DATETIME_WITH_FRACTION;
            case DATETIME_WITH_FRACTION:
                return target.kind == Kind.DATETIME_WITH_FRACTION;
            default:
                return false;
        }
    }

    @Override
    public int compareTo(ColumnType other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        switch (kind) {
            case DECIMAL:
                return "DECIMAL(" + precision + ", " + scale + ")";
            case VARCHAR:
                return "VARCHAR(" + length + ")";
            default:
                return kind.name();
        }
    }
}
