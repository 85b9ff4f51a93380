package io.github.yok.csvimporter.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvRowSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void next_正常ケース_見出しと2行のCSV_見出し名をキーとした行が順に返ること() throws Exception {
        Path file = write("data.csv", "id,name\n1,Alice\n2,Bob\n", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            assertEquals(List.of("id", "name"), source.getColumnNames());
            assertEquals(Map.of("id", "1", "name", "Alice"), source.next());
            assertEquals(Map.of("id", "2", "name", "Bob"), source.next());
            assertFalse(source.hasNext());
            assertThrows(NoSuchElementException.class, source::next);
        }
    }

    @Test
    void next_正常ケース_引用符付きフィールド_区切り文字と改行が値として保持されること() throws Exception {
        Path file = write("quoted.csv", "id,memo\n1,\"a,b\nc\"\n2,\" padded \"\n",
                StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            assertEquals("a,b\nc", source.next().get("memo"));
            assertEquals(" padded ", source.next().get("memo"));
        }
    }

    @Test
    void next_正常ケース_空フィールドと空白_値が加工されずに返ること() throws Exception {
        Path file = write("blank.csv", "a,b,c\n, ,x\n", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            Map<String, String> row = source.next();
            assertEquals("", row.get("a"));
            assertEquals(" ", row.get("b"));
            assertEquals("x", row.get("c"));
        }
    }

    @Test
    void next_正常ケース_フィールド不足の行_空文字で補完されること() throws Exception {
        Path file = write("short.csv", "a,b,c\n1\n", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            Map<String, String> row = source.next();
            assertEquals("1", row.get("a"));
            assertEquals("", row.get("b"));
            assertEquals("", row.get("c"));
        }
    }

    @Test
    void next_正常ケース_フィールド超過の行_余分なフィールドが無視されること() throws Exception {
        Path file = write("long.csv", "a,b\n1,2,3,4\n", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            assertEquals(Map.of("a", "1", "b", "2"), source.next());
        }
    }

    @Test
    void getColumnNames_正常ケース_BOM付きUTF8_BOMが除去されること() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        bytes.write("id,name\n1,x\n".getBytes(StandardCharsets.UTF_8));

        try (CsvRowSource source = new CsvRowSource("bom.csv",
                new ByteArrayInputStream(bytes.toByteArray()), StandardCharsets.UTF_8, ',')) {
            assertEquals("id", source.getColumnNames().get(0));
            assertEquals("1", source.next().get("id"));
        }
    }

    @Test
    void next_正常ケース_タブ区切りとShift_JIS_指定どおりに読み込まれること() throws Exception {
        Charset sjis = Charset.forName("Shift_JIS");
        Path file = write("sjis.tsv", "商品\t価格\nりんご\t120\n", sjis);

        try (CsvRowSource source = new CsvRowSource(file, sjis, '\t')) {
            assertEquals(List.of("商品", "価格"), source.getColumnNames());
            Map<String, String> row = source.next();
            assertEquals("りんご", row.get("商品"));
            assertEquals("120", row.get("価格"));
        }
    }

    @Test
    void getColumnNames_正常ケース_空ファイル_見出しなしで行もないこと() throws Exception {
        Path file = write("empty.csv", "", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            assertTrue(source.getColumnNames().isEmpty());
            assertFalse(source.hasNext());
        }
    }

    @Test
    void constructor_異常ケース_重複した見出し_RowSourceExceptionが送出されること() throws Exception {
        Path file = write("dup.csv", "id,id\n1,2\n", StandardCharsets.UTF_8);

        RowSourceException ex = assertThrows(RowSourceException.class,
                () -> new CsvRowSource(file, StandardCharsets.UTF_8, ','));
        assertEquals(file.toString(), ex.getSource());
        assertNull(ex.getTable());
    }

    @Test
    void constructor_異常ケース_存在しないファイル_RowSourceExceptionが送出されること() {
        Path missing = tempDir.resolve("missing.csv");

        RowSourceException ex = assertThrows(RowSourceException.class,
                () -> new CsvRowSource(missing, StandardCharsets.UTF_8, ','));
        assertTrue(ex.getMessage().contains("Cannot open"));
    }

    @Test
    void next_異常ケース_閉じられていない引用符_RowSourceExceptionが送出されること() throws Exception {
        Path file = write("broken.csv", "id,memo\n1,\"never closed\n", StandardCharsets.UTF_8);

        try (CsvRowSource source = new CsvRowSource(file, StandardCharsets.UTF_8, ',')) {
            assertThrows(RowSourceException.class, () -> {
                while (source.hasNext()) {
                    source.next();
                }
            });
        }
    }

    private Path write(String name, String content, Charset charset) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(charset));
        return file;
    }
}
