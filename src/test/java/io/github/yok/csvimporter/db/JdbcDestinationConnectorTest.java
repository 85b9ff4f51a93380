package io.github.yok.csvimporter.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.core.DestinationException;
import io.github.yok.csvimporter.core.DestinationOperation;
import io.github.yok.csvimporter.core.ReconciledPlan;
import io.github.yok.csvimporter.db.h2.H2DialectHandler;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.ColumnType;
import io.github.yok.csvimporter.schema.TableSchema;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.dbunit.operation.DatabaseOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcDestinationConnectorTest {

    private ConnectionConfig.Entry entry;
    private JdbcDestinationConnector connector;

    @BeforeEach
    void setUp() {
        entry = new ConnectionConfig.Entry();
        entry.setId("h2");
        entry.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        entry.setUser("sa");
        entry.setPassword("");
        entry.setDriverClass("org.h2.Driver");
        connector = JdbcDestinationConnector.open(entry, new H2DialectHandler(),
                new DbUnitConfigFactory(), 100);
    }

    @AfterEach
    void tearDown() throws Exception {
        connector.close();
        try (Connection c = openDirect(); Statement st = c.createStatement()) {
            st.execute("SHUTDOWN");
        }
    }

    @Test
    void resolveSchema_正常ケース_指定なし_H2の既定スキーマが返ること() {
        assertEquals("PUBLIC", connector.resolveSchema(null));
        assertEquals("other", connector.resolveSchema("other"));
        entry.setSchema("CONFIGURED");
        assertEquals("CONFIGURED", connector.resolveSchema(" "));
    }

    @Test
    void fetchTable_正常ケース_テーブルなし_空が返ること() {
        assertFalse(connector.fetchTable("PUBLIC", "sales").isPresent());
    }

    @Test
    void createTable_正常ケース_推論スキーマ_作成後に同じ列型で読み戻せること() {
        connector.createTable(salesSchema());

        Optional<TableSchema> table = connector.fetchTable("PUBLIC", "sales");

        assertTrue(table.isPresent());
        assertEquals(List.of("id", "amount", "sold_on", "note"), table.get().getColumnNames());
        assertEquals(ColumnType.smallInt(), table.get().getColumns().get(0).getType());
        assertEquals(ColumnType.floatType(), table.get().getColumns().get(1).getType());
        assertEquals(ColumnType.date(), table.get().getColumns().get(2).getType());
        assertEquals(ColumnType.varchar(64), table.get().getColumns().get(3).getType());
    }

    @Test
    void fetchTable_正常ケース_引用符なしで作成された表_大文字名で見つかること() throws Exception {
        try (Connection c = openDirect(); Statement st = c.createStatement()) {
            st.execute("CREATE TABLE legacy (code INTEGER, payload BLOB)");
        }

        TableSchema table = connector.fetchTable("PUBLIC", "legacy").orElseThrow();

        assertEquals("LEGACY", table.getTableName());
        assertEquals(ColumnType.integer(), table.getColumns().get(0).getType());
        assertNull(table.getColumns().get(1).getType());
    }

    @Test
    void insertBatch_正常ケース_2行_変換されてコミットされること() throws Exception {
        TableSchema schema = salesSchema();
        connector.createTable(schema);

        int inserted = connector.insertBatch(ReconciledPlan.createNew(schema),
                List.of(row("1", "9.99", "2024-01-15", "a"), row("2", "", "2024-01-16", " ")),
                0);

        assertEquals(2, inserted);
        List<String> rows = selectAll("SELECT \"id\", \"amount\", \"sold_on\", \"note\" "
                + "FROM \"PUBLIC\".\"sales\" ORDER BY \"id\"");
        assertEquals(List.of("1|9.99|2024-01-15|a", "2|null|2024-01-16| "), rows);
    }

    @Test
    void insertBatch_正常ケース_DDL後の再投入_新しい表に投入されること() throws Exception {
        TableSchema schema = salesSchema();
        connector.createTable(schema);
        connector.insertBatch(ReconciledPlan.createNew(schema),
                List.of(row("1", "1.0", "2024-01-15", "old")), 0);

        connector.dropTable("PUBLIC", "sales");
        connector.createTable(schema);
        connector.insertBatch(ReconciledPlan.dropAndRecreate(schema),
                List.of(row("2", "2.0", "2024-01-16", "new")), 0);

        assertEquals(List.of("2|new"),
                selectAll("SELECT \"id\", \"note\" FROM \"PUBLIC\".\"sales\""));
    }

    @Test
    void insertBatch_異常ケース_型に合わない値_BATCH_INSERTの例外でコミットされないこと() throws Exception {
        TableSchema schema = salesSchema();
        connector.createTable(schema);

        DestinationException ex = assertThrows(DestinationException.class,
                () -> connector.insertBatch(ReconciledPlan.createNew(schema),
                        List.of(row("1", "1.0", "2024-01-15", "ok"),
                                row("abc", "1.0", "2024-01-15", "bad")),
                        3));

        assertEquals(DestinationOperation.BATCH_INSERT, ex.getOperation());
        assertEquals(3, ex.getBatchIndex());
        assertEquals("PUBLIC.sales", ex.getTable());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertTrue(selectAll("SELECT \"id\" FROM \"PUBLIC\".\"sales\"").isEmpty());
    }

    @Test
    void insertBatch_異常ケース_書き込み後に失敗_書き込んだ行がロールバックされること() throws Exception {
        TableSchema schema = salesSchema();
        connector.close();
        Connection jdbc = openDirect();
        jdbc.setAutoCommit(false);
        connector = new JdbcDestinationConnector(entry, jdbc, new H2DialectHandler(),
                new DbUnitConfigFactory(), 100, (connection, dataSet) -> {
                    DatabaseOperation.INSERT.execute(connection, dataSet);
                    throw new SQLException("disk full");
                });
        connector.createTable(schema);

        DestinationException ex = assertThrows(DestinationException.class,
                () -> connector.insertBatch(ReconciledPlan.createNew(schema),
                        List.of(row("1", "1.0", "2024-01-15", "x")), 0));

        assertEquals("disk full", ex.getCause().getMessage());
        assertTrue(selectAll("SELECT \"id\" FROM \"PUBLIC\".\"sales\"").isEmpty());
    }

    @Test
    void createTable_異常ケース_同名の表が存在_DDLの例外が送出されること() {
        connector.createTable(salesSchema());

        DestinationException ex = assertThrows(DestinationException.class,
                () -> connector.createTable(salesSchema()));

        assertEquals(DestinationOperation.DDL, ex.getOperation());
        assertInstanceOf(SQLException.class, ex.getCause());
    }

    @Test
    void open_異常ケース_接続できないURL_CONNECTの例外が送出されること() {
        ConnectionConfig.Entry bad = new ConnectionConfig.Entry();
        bad.setId("bad");
        bad.setUrl("jdbc:h2:tcp://127.0.0.1:1/nowhere");
        bad.setUser("sa");

        DestinationException ex = assertThrows(DestinationException.class,
                () -> JdbcDestinationConnector.open(bad, new H2DialectHandler(),
                        new DbUnitConfigFactory(), 10));

        assertEquals(DestinationOperation.CONNECT, ex.getOperation());
    }

    @Test
    void open_異常ケース_存在しないドライバクラス_IllegalStateExceptionが送出されること() {
        ConnectionConfig.Entry bad = new ConnectionConfig.Entry();
        bad.setUrl("jdbc:h2:mem:unused");
        bad.setDriverClass("com.example.MissingDriver");

        assertThrows(IllegalStateException.class, () -> JdbcDestinationConnector.open(bad,
                new H2DialectHandler(), new DbUnitConfigFactory(), 10));
    }

    private static TableSchema salesSchema() {
        return new TableSchema("PUBLIC", "sales",
                List.of(ColumnDefinition.inferred("id", "id", ColumnType.smallInt()),
                        ColumnDefinition.inferred("amount", "amount", ColumnType.floatType()),
                        ColumnDefinition.inferred("sold_on", "sold on", ColumnType.date()),
                        ColumnDefinition.inferred("note", "note", ColumnType.varchar(64))));
    }

    private static Map<String, String> row(String id, String amount, String soldOn,
            String note) {
        return Map.of("id", id, "amount", amount, "sold on", soldOn, "note", note);
    }

    private Connection openDirect() throws SQLException {
        return DriverManager.getConnection(entry.getUrl(), "sa", "");
    }

    private List<String> selectAll(String sql) throws SQLException {
        List<String> rows = new ArrayList<>();
        try (Connection c = openDirect(); Statement st = c.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            int count = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                StringBuilder sb = new StringBuilder();
                for (int i = 1; i <= count; i++) {
                    if (i > 1) {
                        sb.append('|');
                    }
                    sb.append(rs.getString(i));
                }
                rows.add(sb.toString());
            }
        }
        return rows;
    }
}
