package io.github.yok.csvimporter.infer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ValueClassifierTest {

    private final ValueClassifier classifier = new ValueClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t", "   "})
    void classify_正常ケース_空または空白のみ_NULLと判定されること(String raw) {
        assertEquals(ValueKind.NULL, classifier.classify(raw).getKind());
    }

    @Test
    void classify_正常ケース_空白のみ_空白の長さが記録されること() {
        assertEquals(0, classifier.classify("").getLength());
        assertEquals(3, classifier.classify("   ").getLength());
    }

    @Test
    void classify_正常ケース_nullを指定する_NULLと判定されること() {
        assertEquals(ValueKind.NULL, classifier.classify(null).getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "FALSE", "Yes", "no"})
    void classify_正常ケース_真偽値の単語_BOOLEANと判定されること(String raw) {
        assertEquals(ValueKind.BOOLEAN, classifier.classify(raw).getKind());
    }

    @Test
    void classify_正常ケース_整数_値と桁数が記録されること() {
        ClassificationHint hint = classifier.classify("-00123");
        assertEquals(ValueKind.INTEGER, hint.getKind());
        assertEquals(BigInteger.valueOf(-123), hint.getIntegerValue());
        assertEquals(3, hint.getIntegerDigits());
        assertEquals(6, hint.getLength());
        assertFalse(hint.isBooleanDigit());
    }

    @Test
    void classify_正常ケース_0と1_整数かつ真偽値の数字として判定されること() {
        ClassificationHint zero = classifier.classify("0");
        ClassificationHint one = classifier.classify("1");
        assertEquals(ValueKind.INTEGER, zero.getKind());
        assertTrue(zero.isBooleanDigit());
        assertEquals(1, zero.getIntegerDigits());
        assertEquals(ValueKind.INTEGER, one.getKind());
        assertTrue(one.isBooleanDigit());
    }

    @Test
    void classify_正常ケース_前後に空白のある整数_元の長さを保ったまま整数と判定されること() {
        ClassificationHint hint = classifier.classify(" 42 ");
        assertEquals(ValueKind.INTEGER, hint.getKind());
        assertEquals(4, hint.getLength());
    }

    @Test
    void classify_正常ケース_15桁以内の小数_FLOATと判定されること() {
        ClassificationHint hint = classifier.classify("3.14");
        assertEquals(ValueKind.FLOAT, hint.getKind());
        assertEquals(1, hint.getIntegerDigits());
        assertEquals(2, hint.getScale());
        assertNull(hint.getIntegerValue());
    }

    @Test
    void classify_正常ケース_整数部省略の小数_FLOATと判定されること() {
        assertEquals(ValueKind.FLOAT, classifier.classify(".5").getKind());
        assertEquals(ValueKind.FLOAT, classifier.classify("5.").getKind());
    }

    @Test
    void classify_正常ケース_16桁から38桁の小数_DECIMALと判定されること() {
        ClassificationHint hint = classifier.classify("12345678901234.56");
        assertEquals(ValueKind.DECIMAL, hint.getKind());
        assertEquals(14, hint.getIntegerDigits());
        assertEquals(2, hint.getScale());
    }

    @Test
    void classify_正常ケース_38桁を超える小数_TEXTと判定されること() {
        String raw = "1234567890123456789012345678901234567890.5";
        assertEquals(ValueKind.TEXT, classifier.classify(raw).getKind());
    }

    @Test
    void classify_正常ケース_小数点のみ_TEXTと判定されること() {
        assertEquals(ValueKind.TEXT, classifier.classify(".").getKind());
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"2024-01-15", "2024/01/15", "2024.01.15", "1/5/2024", "2024年1月5日"})
    void classify_正常ケース_日付_DATEと判定されること(String raw) {
        assertEquals(ValueKind.DATE, classifier.classify(raw).getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-15 10:30:00", "2024-01-15T10:30", "2024/01/15 23:59:59",
            "2024-01-15T10:30:00Z", "2024-01-15T10:30:00+09:00"})
    void classify_正常ケース_日時_DATETIMEと判定されること(String raw) {
        assertEquals(ValueKind.DATETIME, classifier.classify(raw).getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-15 10:30:00.123", "2024-01-15T10:30:00.123456789",
            "2024-01-15T10:30:00.5Z"})
    void classify_正常ケース_小数秒付き日時_DATETIME_WITH_FRACTIONと判定されること(String raw) {
        assertEquals(ValueKind.DATETIME_WITH_FRACTION, classifier.classify(raw).getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-02-30", "2024-13-01", "2024-01-15 25:00:00", "hello",
            "12abc", "1,000"})
    void classify_正常ケース_解釈できない値_TEXTと判定されること(String raw) {
        ClassificationHint hint = classifier.classify(raw);
        assertEquals(ValueKind.TEXT, hint.getKind());
        assertEquals(raw.length(), hint.getLength());
    }
}
