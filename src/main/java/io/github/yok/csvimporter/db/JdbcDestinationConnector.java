package io.github.yok.csvimporter.db;

import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.core.DestinationConnector;
import io.github.yok.csvimporter.core.DestinationException;
import io.github.yok.csvimporter.core.DestinationOperation;
import io.github.yok.csvimporter.core.ReconciledPlan;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.IdentifierRules;
import io.github.yok.csvimporter.schema.TableSchema;
import io.github.yok.csvimporter.util.JdbcDriverLoader;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * {@link DestinationConnector} over a single JDBC connection.
 *
 * <p>
 * The connection runs with auto-commit off. DDL statements are committed immediately. Each batch is
 * converted by {@link ValueConverter}, written with DBUnit's {@link DatabaseOperation#INSERT} using
 * batched statements, and committed; a failed batch is rolled back.
 * </p>
 *
 * <p>
 * DBUnit caches the table list of a connection, so its connection is created lazily for the first
 * batch and discarded whenever DDL runs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcDestinationConnector implements DestinationConnector {

    /**
     * DBUnit write operation (replaceable in tests).
     */
    @FunctionalInterface
    interface InsertExecutor {

        /**
         * Inserts every row of the dataset.
         *
         * @param connection DBUnit connection
         * @param dataSet rows to insert
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    private final ConnectionConfig.Entry entry;
    private final Connection jdbc;
    private final DbDialectHandler dialect;
    private final DbUnitConfigFactory configFactory;
    private final int batchSize;
    private final InsertExecutor insertExecutor;
    private final ValueConverter converter;

    // DBUnit connection of the current schema; reset after DDL
    private DatabaseConnection dbUnitConnection;
    private String dbUnitSchema;

    /**
     * Creates a connector over an open connection.
     *
     * @param entry connection entry (used for the default schema)
     * @param jdbc open JDBC connection, owned by this connector
     * @param dialect dialect of the connection
     * @param configFactory DBUnit settings
     * @param batchSize rows per JDBC batch
     */
    public JdbcDestinationConnector(ConnectionConfig.Entry entry, Connection jdbc,
            DbDialectHandler dialect, DbUnitConfigFactory configFactory, int batchSize) {
        this(entry, jdbc, dialect, configFactory, batchSize,
                (connection, dataSet) -> DatabaseOperation.INSERT.execute(connection, dataSet));
    }

    JdbcDestinationConnector(ConnectionConfig.Entry entry, Connection jdbc,
            DbDialectHandler dialect, DbUnitConfigFactory configFactory, int batchSize,
            InsertExecutor insertExecutor) {
        this.entry = entry;
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.configFactory = configFactory;
        this.batchSize = batchSize;
        this.insertExecutor = insertExecutor;
        this.converter = new ValueConverter(dialect.isBooleanNumeric());
    }

    /**
     * Opens a connection for a configured entry.
     *
     * @param entry connection entry
     * @param dialect dialect of the entry
     * @param configFactory DBUnit settings
     * @param batchSize rows per JDBC batch
     * @return connector
     * @throws DestinationException if the connection cannot be opened or prepared
     * @throws IllegalStateException if the configured driver class is missing
     */
    public static JdbcDestinationConnector open(ConnectionConfig.Entry entry,
            DbDialectHandler dialect, DbUnitConfigFactory configFactory, int batchSize) {
        try {
            JdbcDriverLoader.loadIfConfigured(entry.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver not found: " + entry.getDriverClass(), e);
        }
        Connection jdbc = null;
        try {
            jdbc = DriverManager.getConnection(entry.getUrl(), entry.getUser(),
                    entry.getPassword());
            jdbc.setAutoCommit(false);
            dialect.prepareConnection(jdbc);
            log.info("[{}] Connected to {}", entry.getId(), entry.getUrl());
            return new JdbcDestinationConnector(entry, jdbc, dialect, configFactory, batchSize);
        } catch (SQLException e) {
            if (jdbc != null) {
                closeQuietly(jdbc, e);
            }
            log.error("[{}] Failed to establish JDBC connection or initialize session",
                    entry.getId(), e);
            throw new DestinationException(DestinationOperation.CONNECT, entry.getUrl(), e);
        }
    }

    @Override
    public String resolveSchema(String requested) {
        if (StringUtils.isNotBlank(requested)) {
            return requested;
        }
        if (StringUtils.isNotBlank(entry.getSchema())) {
            return entry.getSchema();
        }
        return dialect.resolveSchema(entry);
    }

    @Override
    public IdentifierRules getIdentifierRules() {
        return dialect.getIdentifierRules();
    }

    /**
     * Looks the table up by its exact name first, then upper- and lower-cased, so that tables
     * created with unquoted names are found as well.
     */
    @Override
    public Optional<TableSchema> fetchTable(String schema, String table) {
        try {
            DatabaseMetaData md = jdbc.getMetaData();
            Set<String> candidates = new LinkedHashSet<>();
            candidates.add(table);
            candidates.add(table.toUpperCase(Locale.ROOT));
            candidates.add(table.toLowerCase(Locale.ROOT));
            for (String candidate : candidates) {
                List<ColumnDefinition> columns = readColumns(md, schema, candidate);
                if (!columns.isEmpty()) {
                    log.info("Table {} exists with {} columns",
                            TableSchema.qualify(schema, candidate), columns.size());
                    return Optional.of(new TableSchema(schema, candidate, columns));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DestinationException(DestinationOperation.METADATA_FETCH,
                    TableSchema.qualify(schema, table), e);
        }
    }

    @Override
    public void dropTable(String schema, String table) {
        executeDdl(dialect.buildDropTableSql(schema, table), TableSchema.qualify(schema, table));
    }

    @Override
    public void createTable(TableSchema schema) {
        executeDdl(dialect.buildCreateTableSql(schema), schema.getQualifiedName());
    }

    @Override
    public int insertBatch(ReconciledPlan plan, List<Map<String, String>> rows, int batchIndex) {
        TableSchema target = plan.getTarget();
        List<ColumnDefinition> columns = plan.getInsertColumns();
        try {
            Column[] dbUnitColumns = columns.stream()
                    .map(c -> new Column(c.getName(), DataType.UNKNOWN)).toArray(Column[]::new);
            DefaultTable table = new DefaultTable(
                    new DefaultTableMetaData(dbUnitTableName(target), dbUnitColumns));
            for (Map<String, String> row : rows) {
                table.addRow(converter.convertRow(columns, row));
            }
            insertExecutor.insert(dbUnitConnection(target.getSchema()),
                    new DefaultDataSet(table));
            jdbc.commit();
            return rows.size();
        } catch (Exception e) {
            rollbackQuietly(e);
            throw new DestinationException(DestinationOperation.BATCH_INSERT,
                    target.getQualifiedName(), batchIndex, e);
        }
    }

    @Override
    public void close() {
        try {
            jdbc.close();
            log.info("[{}] Connection closed", entry.getId());
        } catch (SQLException e) {
            log.warn("[{}] Failed to close JDBC connection: {}", entry.getId(), e.getMessage(), e);
        }
    }

    private List<ColumnDefinition> readColumns(DatabaseMetaData md, String schema, String table)
            throws SQLException {
        String escape = md.getSearchStringEscape();
        String catalog = dialect.isSchemaCatalog() ? schema : null;
        String schemaPattern = dialect.isSchemaCatalog() ? null : escapePattern(schema, escape);
        List<ColumnDefinition> columns = new ArrayList<>();
        try (ResultSet rs =
                md.getColumns(catalog, schemaPattern, escapePattern(table, escape), null)) {
            while (rs.next()) {
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String name = rs.getString("COLUMN_NAME");
                String typeName = rs.getString("TYPE_NAME");
                columns.add(ColumnDefinition.existing(name,
                        dialect.fromJdbcType(rs.getInt("DATA_TYPE"), typeName,
                                rs.getInt("COLUMN_SIZE"), rs.getInt("DECIMAL_DIGITS")),
                        typeName));
            }
        }
        return columns;
    }

    private void executeDdl(String sql, String table) {
        log.info("Executing DDL:\n{}", sql);
        try (Statement st = jdbc.createStatement()) {
            st.execute(sql);
            jdbc.commit();
            dbUnitConnection = null;
        } catch (SQLException e) {
            rollbackQuietly(e);
            throw new DestinationException(DestinationOperation.DDL, table, e);
        }
    }

    private IDatabaseConnection dbUnitConnection(String schema) throws DatabaseUnitException {
        if (dbUnitConnection == null || !StringUtils.equals(dbUnitSchema, schema)) {
            DatabaseConnection connection = new DatabaseConnection(jdbc, schema);
            configFactory.configure(connection.getConfig(), dialect, batchSize);
            dbUnitConnection = connection;
            dbUnitSchema = schema;
        }
        return dbUnitConnection;
    }

    private static String dbUnitTableName(TableSchema target) {
        return StringUtils.isEmpty(target.getSchema()) ? target.getTableName()
                : target.getSchema() + "." + target.getTableName();
    }

    private static String escapePattern(String name, String escape) {
        if (name == null || StringUtils.isEmpty(escape)) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%",
                escape + "%");
    }

    private void rollbackQuietly(Exception primary) {
        try {
            jdbc.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
            primary.addSuppressed(rollbackEx);
        }
    }

    private static void closeQuietly(Connection jdbc, Exception primary) {
        try {
            jdbc.close();
        } catch (SQLException closeEx) {
            primary.addSuppressed(closeEx);
        }
    }
}
