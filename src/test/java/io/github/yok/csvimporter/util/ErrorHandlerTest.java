package io.github.yok.csvimporter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.csvimporter.core.BatchFailure;
import io.github.yok.csvimporter.core.BatchLoadException;
import io.github.yok.csvimporter.core.LoadSummary;
import io.github.yok.csvimporter.core.SourceReadException;
import io.github.yok.csvimporter.parser.RowSourceException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        ErrorHandler instance = constructor.newInstance();
        assertEquals(ErrorHandler.class, instance.getClass());
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ根本原因が出力されること() {
        String message = captureErr(() -> assertEquals(ErrorHandler.EXIT_FAILURE,
                ErrorHandler.errorAndExit("boom",
                        new IllegalStateException("wrapper", new SQLException("root")))));
        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("SQLException: root"));
    }

    @Test
    void describe_正常ケース_バッチ失敗_コミット済み行数が付加されること() {
        LoadSummary summary = mock(LoadSummary.class);
        when(summary.getInsertedRows()).thenReturn(2000L);
        BatchLoadException ex = new BatchLoadException("PUBLIC.sales",
                new BatchFailure(2, 2001, 3000, "value too long"), summary,
                new SQLException("value too long"));

        String description = ErrorHandler.describe(ex);

        assertTrue(description.startsWith("SQLException: value too long"));
        assertTrue(description.endsWith("(2000 rows committed before the failure)"));
    }

    @Test
    void describe_正常ケース_読込失敗_コミット済み行数が付加されること() {
        LoadSummary summary = mock(LoadSummary.class);
        when(summary.getInsertedRows()).thenReturn(3L);
        SourceReadException ex = new SourceReadException("PUBLIC.sales", 4, summary,
                new RowSourceException("sales.csv", "Failed to read CSV at record 4", null));

        String description = ErrorHandler.describe(ex);

        assertTrue(description.contains("Failed to read CSV at record 4"));
        assertTrue(description.endsWith("(3 rows committed before the failure)"));
    }

    private static String captureErr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString(StandardCharsets.UTF_8);
    }
}
