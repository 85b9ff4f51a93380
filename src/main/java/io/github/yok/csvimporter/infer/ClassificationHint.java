package io.github.yok.csvimporter.infer;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of classifying one raw CSV value.
 *
 * <p>
 * Besides the {@link ValueKind}, a hint carries the measurements the column reducer needs: the
 * raw length in characters, the number of digits before and after the decimal point, the parsed
 * integer value and whether the value is one of the boolean digits {@code 0}/{@code 1}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ClassificationHint {

    private static final ClassificationHint NULL_HINT =
            new ClassificationHint(ValueKind.NULL, 0, 0, 0, null, false);

    // Classified kind
    private final ValueKind kind;

    // Length of the raw value in characters
    private final int length;

    // Significant digits before the decimal point (numeric kinds only)
    private final int integerDigits;

    // Digits after the decimal point (numeric kinds only)
    private final int scale;

    // Parsed value (INTEGER only)
    private final BigInteger integerValue;

    // True when the value is the literal 0 or 1
    private final boolean booleanDigit;

    static ClassificationHint nullValue() {
        return NULL_HINT;
    }

    static ClassificationHint of(ValueKind kind, int length) {
        return new ClassificationHint(kind, length, 0, 0, null, false);
    }
}
