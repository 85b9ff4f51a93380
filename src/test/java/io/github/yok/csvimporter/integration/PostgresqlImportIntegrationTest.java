package io.github.yok.csvimporter.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.ImporterConfig;
import io.github.yok.csvimporter.core.ConflictPolicy;
import io.github.yok.csvimporter.core.CsvImporter;
import io.github.yok.csvimporter.core.ImportRequest;
import io.github.yok.csvimporter.core.LoadSummary;
import io.github.yok.csvimporter.core.TableExistsException;
import io.github.yok.csvimporter.db.DbDialectHandler;
import io.github.yok.csvimporter.db.DbDialectHandlerFactory;
import io.github.yok.csvimporter.db.DbUnitConfigFactory;
import io.github.yok.csvimporter.db.JdbcDestinationConnector;
import io.github.yok.csvimporter.parser.CsvRowSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests against a PostgreSQL container.
 *
 * <p>
 * Skipped when no Docker environment is available.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresqlImportIntegrationTest {

    @TempDir
    Path tempDir;

    @Container
    private static final PostgreSQLContainer<?> postgres = createPostgres();

    private ConnectionConfig.Entry entry;
    private String table;

    private static PostgreSQLContainer<?> createPostgres() {
        PostgreSQLContainer<?> container = new PostgreSQLContainer<>("postgres:16-alpine");
        container.withDatabaseName("testdb").withUsername("test").withPassword("test");
        return container;
    }

    @BeforeEach
    void setup() {
        entry = new ConnectionConfig.Entry();
        entry.setId("pg");
        entry.setUrl(postgres.getJdbcUrl());
        entry.setUser(postgres.getUsername());
        entry.setPassword(postgres.getPassword());
        entry.setDriverClass("org.postgresql.Driver");
        table = "sales_" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void run_正常ケース_各種の値を投入_PostgreSQLの型で作成され全件登録されること() throws Exception {
        Path csv = write("typed.csv",
                "id,big,price,ratio,active,sold_on,sold_at,note\n"
                        + "1,5000000000,12345678901234.56,0.25,true,2024-01-15,"
                        + "2024-01-15 10:30:00.123456,Mixed Case\n"
                        + "2,-1,0.01,1.5,no,2024/02/29,2024-02-29T23:59:59,\n");

        LoadSummary summary = importFile(csv, ConflictPolicy.FAIL);

        assertEquals(2, summary.getInsertedRows());
        Map<String, String> types = columnTypes();
        assertEquals("smallint", types.get("id"));
        assertEquals("bigint", types.get("big"));
        assertEquals("numeric", types.get("price"));
        assertEquals("double precision", types.get("ratio"));
        assertEquals("boolean", types.get("active"));
        assertEquals("date", types.get("sold_on"));
        assertEquals("timestamp without time zone", types.get("sold_at"));
        assertEquals("character varying", types.get("note"));

        try (Connection conn = openDirect(); PreparedStatement ps = conn.prepareStatement(
                "SELECT big, price, active, sold_on, sold_at, note FROM public.\"" + table
                        + "\" WHERE id = 1")) {
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(5000000000L, rs.getLong("big"));
                assertEquals("12345678901234.56", rs.getBigDecimal("price").toPlainString());
                assertTrue(rs.getBoolean("active"));
                assertEquals("2024-01-15", rs.getDate("sold_on").toString());
                assertEquals("2024-01-15 10:30:00.123456", rs.getTimestamp("sold_at").toString());
                assertEquals("Mixed Case", rs.getString("note"));
            }
        }
    }

    @Test
    void run_正常ケース_REPLACEで再投入_旧データが残らないこと() throws Exception {
        importFile(write("old.csv", "id\n1\n2\n3\n"), ConflictPolicy.FAIL);
        assertThrows(TableExistsException.class,
                () -> importFile(write("dup.csv", "id\n9\n"), ConflictPolicy.FAIL));

        importFile(write("new.csv", "id\n10\n"), ConflictPolicy.REPLACE);

        try (Connection conn = openDirect(); Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(
                        "SELECT COUNT(*), MAX(id) FROM public.\"" + table + "\"")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
            assertEquals(10, rs.getInt(2));
        }
    }

    private LoadSummary importFile(Path csv, ConflictPolicy policy) throws IOException {
        ImporterConfig config = new ImporterConfig();
        ImportRequest request = ImportRequest.of(table, config);
        request.setIfExists(policy);
        DbDialectHandler dialect = new DbDialectHandlerFactory().create(entry);
        try (JdbcDestinationConnector connector = JdbcDestinationConnector.open(entry, dialect,
                new DbUnitConfigFactory(), request.getBatchSize());
                CsvRowSource source = new CsvRowSource(csv, StandardCharsets.UTF_8, ',')) {
            return new CsvImporter(connector, config).run(request, source);
        }
    }

    private Map<String, String> columnTypes() throws SQLException {
        Map<String, String> types = new LinkedHashMap<>();
        try (Connection conn = openDirect(); PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name, data_type FROM information_schema.columns "
                        + "WHERE table_schema = 'public' AND table_name = ? "
                        + "ORDER BY ordinal_position")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    types.put(rs.getString(1), rs.getString(2));
                }
            }
        }
        return types;
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private Connection openDirect() throws SQLException {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(),
                postgres.getPassword());
    }
}
