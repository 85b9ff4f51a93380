package io.github.yok.csvimporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ConflictPolicyTest {

    @Test
    void parse_正常ケース_大文字小文字と前後空白を問わず_対応するポリシーが返ること() {
        assertEquals(ConflictPolicy.FAIL, ConflictPolicy.parse("fail"));
        assertEquals(ConflictPolicy.REPLACE, ConflictPolicy.parse(" Replace "));
        assertEquals(ConflictPolicy.APPEND, ConflictPolicy.parse("APPEND"));
    }

    @Test
    void parse_異常ケース_未知の値_選択肢を含むIllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> ConflictPolicy.parse("merge"));
        assertTrue(ex.getMessage().contains("fail, replace, append"));
        assertThrows(IllegalArgumentException.class, () -> ConflictPolicy.parse(null));
    }
}
