package io.github.yok.csvimporter.infer;

import java.math.BigInteger;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single raw CSV value into a {@link ClassificationHint}.
 *
 * <p>
 * Rules are evaluated in a fixed precedence and the first match wins:
 * </p>
 * <ol>
 * <li>empty or whitespace-only: {@link ValueKind#NULL}</li>
 * <li>{@code true/false/yes/no} (any case): {@link ValueKind#BOOLEAN}</li>
 * <li>optional sign and digits: {@link ValueKind#INTEGER}</li>
 * <li>optional sign, digits and one decimal point: {@link ValueKind#FLOAT} when the digits fit a
 * double exactly, {@link ValueKind#DECIMAL} up to 38 digits, otherwise text</li>
 * <li>date, date-time or date-time with fractional seconds in one of
 * {@link TemporalFormats}</li>
 * <li>anything else: {@link ValueKind#TEXT}</li>
 * </ol>
 *
 * <p>
 * {@code 0} and {@code 1} are classified as integers and flagged as boolean digits; whether a
 * column of such values is boolean is decided per column by the inferencer. Classification never
 * throws: values that fail a stricter rule simply fall through to a wider one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ValueClassifier {

    /**
     * Number of decimal digits a double represents exactly.
     */
    public static final int FLOAT_MAX_DIGITS = 15;

    /**
     * Maximum number of digits of an exact decimal.
     */
    public static final int DECIMAL_MAX_DIGITS = 38;

    private static final Set<String> BOOLEAN_WORDS = Set.of("true", "false", "yes", "no");
    private static final Pattern INTEGER = Pattern.compile("[+-]?(\\d+)");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d*)\\.(\\d*)");

    /**
     * Classifies one raw value.
     *
     * @param raw raw CSV field, may be {@code null}
     * @return classification hint, never {@code null}
     */
    public ClassificationHint classify(String raw) {
        if (raw == null || raw.isEmpty()) {
            return ClassificationHint.nullValue();
        }
        if (raw.isBlank()) {
            return ClassificationHint.of(ValueKind.NULL, raw.length());
        }
        String value = raw.strip();
        int length = raw.length();

        if (BOOLEAN_WORDS.contains(value.toLowerCase(Locale.ROOT))) {
            return ClassificationHint.of(ValueKind.BOOLEAN, length);
        }

        Matcher integer = INTEGER.matcher(value);
        if (integer.matches()) {
            return integerHint(value, integer.group(1), length);
        }

        Matcher decimal = DECIMAL.matcher(value);
        if (decimal.matches() && (!decimal.group(1).isEmpty() || !decimal.group(2).isEmpty())) {
            return decimalHint(decimal.group(1), decimal.group(2), length);
        }

        ValueKind temporal = classifyTemporal(value);
        if (temporal != null) {
            return ClassificationHint.of(temporal, length);
        }
        return ClassificationHint.of(ValueKind.TEXT, length);
    }

    private ClassificationHint integerHint(String value, String digits, int length) {
        int significant = significantDigits(digits);
        boolean booleanDigit = "0".equals(value) || "1".equals(value);
        return new ClassificationHint(ValueKind.INTEGER, length, Math.max(1, significant), 0,
                new BigInteger(value), booleanDigit);
    }

    private ClassificationHint decimalHint(String intPart, String fracPart, int length) {
        int integerDigits = significantDigits(intPart);
        int scale = fracPart.length();
        int precision = Math.max(1, integerDigits + scale);
        ValueKind kind;
        if (precision <= FLOAT_MAX_DIGITS) {
            kind = ValueKind.FLOAT;
        } else if (precision <= DECIMAL_MAX_DIGITS) {
            kind = ValueKind.DECIMAL;
        } else {
            return ClassificationHint.of(ValueKind.TEXT, length);
        }
        return new ClassificationHint(kind, length, integerDigits, scale, null, false);
    }

    private ValueKind classifyTemporal(String value) {
        Matcher m = TemporalFormats.DATE_TIME.matcher(value);
        if (!m.matches() || !isDate(m.group(1))) {
            return null;
        }
        String time = m.group(2);
        if (time == null) {
            return ValueKind.DATE;
        }
        Matcher zoned = TemporalFormats.ZONE_SUFFIX.matcher(time);
        String localTime = zoned.matches() && isTime(zoned.group(1)) ? zoned.group(1) : time;
        if (!isTime(localTime)) {
            return null;
        }
        return localTime.indexOf('.') >= 0 ? ValueKind.DATETIME_WITH_FRACTION
                : ValueKind.DATETIME;
    }

    private boolean isDate(String text) {
        return TemporalFormats.DATE_FORMATTERS.stream().anyMatch(f -> parses(f, text));
    }

    private boolean isTime(String text) {
        return parses(TemporalFormats.TIME_FORMATTER, text);
    }

    private static boolean parses(DateTimeFormatter formatter, String text) {
        try {
            formatter.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static int significantDigits(String digits) {
        int i = 0;
        while (i < digits.length() && digits.charAt(i) == '0') {
            i++;
        }
        return digits.length() - i;
    }
}
