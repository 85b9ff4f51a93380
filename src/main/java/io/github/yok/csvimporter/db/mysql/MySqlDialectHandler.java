package io.github.yok.csvimporter.db.mysql;

import com.google.common.collect.ImmutableSet;
import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.AbstractDbDialectHandler;
import io.github.yok.csvimporter.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import org.dbunit.database.IMetadataHandler;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlMetadataHandler;

/**
 * MySQL dialect handler.
 *
 * <p>
 * MySQL has no schemas below the database level: the database named in the JDBC URL is used as the
 * schema and passed to JDBC metadata calls as the catalog. Identifiers are quoted with backticks.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler extends AbstractDbDialectHandler {

    /**
     * Maximum identifier length.
     */
    public static final int MAX_IDENTIFIER_LENGTH = 64;

    /**
     * MySQL reserved words beyond the SQL standard set.
     */
    public static final Set<String> RESERVED_WORDS = ImmutableSet.of("accessible", "analyze",
            "before", "both", "call", "cascade", "change", "condition", "database", "databases",
            "dec", "declare", "delayed", "describe", "div", "double", "dual", "each", "escaped",
            "exit", "explain", "float", "force", "fulltext", "generated", "if", "ignore", "index",
            "int", "integer", "interval", "key", "keys", "kill", "leading", "leave", "limit",
            "lines", "load", "lock", "long", "loop", "match", "mod", "modifies", "optimize",
            "option", "optionally", "outfile", "partition", "procedure", "range", "read", "reads",
            "regexp", "release", "rename", "repeat", "replace", "require", "restrict", "return",
            "revoke", "rlike", "schema", "schemas", "separator", "show", "signal", "spatial",
            "sql", "ssl", "starting", "stored", "straight_join", "terminated", "trailing",
            "trigger", "undo", "unlock", "unsigned", "usage", "use", "utc_date", "utc_time",
            "utc_timestamp", "varying", "virtual", "while", "write", "xor", "year_month",
            "zerofill");

    private static final IDataTypeFactory MYSQL_TYPE_FACTORY = new MySqlDataTypeFactory();

    /**
     * Creates the handler.
     */
    public MySqlDialectHandler() {
        super(DataTypeFactoryMode.MYSQL, "`", "`", MAX_IDENTIFIER_LENGTH, RESERVED_WORDS);
    }

    @Override
    protected String typeName(ColumnType.Kind kind) {
        switch (kind) {
            case BOOLEAN:
                return "BOOLEAN";
            case SMALLINT:
                return "SMALLINT";
            case INT:
                return "INT";
            case BIGINT:
                return "BIGINT";
            case FLOAT:
                return "DOUBLE";
            case DATE:
                return "DATE";
            case DATETIME:
                return "DATETIME";
            case DATETIME_WITH_FRACTION:
                return "DATETIME(6)";
            case VARCHAR_MAX:
                return "LONGTEXT";
            default:
                throw new IllegalArgumentException("Unexpected kind: " + kind);
        }
    }

    /**
     * Applies MySQL session settings.
     *
     * @param connection JDBC connection
     * @throws SQLException on SQL errors
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET NAMES utf8mb4");
        }
    }

    /**
     * Resolves the MySQL database name from the JDBC URL.
     *
     * @param entry connection config entry
     * @return database name, or {@code null} when the URL names none
     */
    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        String jdbcUrl = entry.getUrl();
        if (jdbcUrl == null) {
            return null;
        }
        int slash = jdbcUrl.lastIndexOf('/');
        if (slash < 0 || slash == jdbcUrl.length() - 1) {
            return null;
        }
        String tail = jdbcUrl.substring(slash + 1);
        int q = tail.indexOf('?');
        String dbName = q >= 0 ? tail.substring(0, q) : tail;
        return dbName.isBlank() ? null : dbName;
    }

    @Override
    public boolean isSchemaCatalog() {
        return true;
    }

    @Override
    public IMetadataHandler getMetadataHandler() {
        return new MySqlMetadataHandler();
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return MYSQL_TYPE_FACTORY;
    }

    @Override
    protected String identityColumnType() {
        return "INT AUTO_INCREMENT PRIMARY KEY";
    }
}
