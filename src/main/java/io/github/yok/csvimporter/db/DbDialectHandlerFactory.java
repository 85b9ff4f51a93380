package io.github.yok.csvimporter.db;

import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.DataTypeFactoryMode;
import io.github.yok.csvimporter.db.h2.H2DialectHandler;
import io.github.yok.csvimporter.db.mysql.MySqlDialectHandler;
import io.github.yok.csvimporter.db.oracle.OracleDialectHandler;
import io.github.yok.csvimporter.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.csvimporter.db.sqlserver.SqlServerDialectHandler;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database type.
 *
 * <p>
 * The database type is resolved per {@link ConnectionConfig.Entry} using
 * {@code connections[].driver-class} first and the JDBC URL as a fallback.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates a {@link DbDialectHandler} based on the provided connection entry.
     *
     * <p>
     * Supported database types (resolved from {@code driver-class} or JDBC URL):
     * </p>
     * <ul>
     * <li>{@code SQLSERVER}: {@link SqlServerDialectHandler}</li>
     * <li>{@code POSTGRESQL}: {@link PostgresqlDialectHandler}</li>
     * <li>{@code MYSQL}: {@link MySqlDialectHandler} (MariaDB included)</li>
     * <li>{@code ORACLE}: {@link OracleDialectHandler}</li>
     * <li>{@code H2}: {@link H2DialectHandler}</li>
     * </ul>
     *
     * @param entry connection information
     * @return dialect handler
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    public DbDialectHandler create(ConnectionConfig.Entry entry) {
        DataTypeFactoryMode mode = resolveMode(entry);
        log.info("[{}] Database dialect resolved: {}", entry.getId(), mode);
        switch (mode) {
            case SQLSERVER:
                return new SqlServerDialectHandler();
            case POSTGRESQL:
                return new PostgresqlDialectHandler();
            case MYSQL:
                return new MySqlDialectHandler();
            case ORACLE:
                return new OracleDialectHandler();
            case H2:
                return new H2DialectHandler();
            default:
                throw new IllegalArgumentException("Unsupported DataTypeFactoryMode: " + mode);
        }
    }

    /**
     * Resolves the database type for a connection entry.
     *
     * <p>
     * Resolution priority is {@code driver-class} first, then JDBC URL.
     * </p>
     *
     * @param entry connection entry
     * @return resolved database type
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    public DataTypeFactoryMode resolveMode(ConnectionConfig.Entry entry) {
        DataTypeFactoryMode fromDriverClass = resolveModeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }

        DataTypeFactoryMode fromUrl = resolveModeFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }

        String message = "Unsupported database dialect for connection id=" + entry.getId()
                + " (driver-class=" + entry.getDriverClass() + ", url=" + entry.getUrl() + ")";
        throw new IllegalArgumentException(message);
    }

    /**
     * Resolves the database type from a JDBC driver class name.
     *
     * @param driverClass JDBC driver class name
     * @return resolved database type, or {@code null} when not recognized
     */
    private DataTypeFactoryMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("oracle.jdbc.oracledriver".equals(normalized)
                || "oracle.jdbc.driver.oracledriver".equals(normalized)) {
            return DataTypeFactoryMode.ORACLE;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)
                || "org.mariadb.jdbc.driver".equals(normalized)) {
            return DataTypeFactoryMode.MYSQL;
        }
        if ("com.microsoft.sqlserver.jdbc.sqlserverdriver".equals(normalized)) {
            return DataTypeFactoryMode.SQLSERVER;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    /**
     * Resolves the database type from a JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return resolved database type, or {@code null} when not recognized
     */
    private DataTypeFactoryMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:oracle:")) {
            return DataTypeFactoryMode.ORACLE;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:mariadb:")) {
            return DataTypeFactoryMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:sqlserver:")) {
            return DataTypeFactoryMode.SQLSERVER;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    /**
     * Normalizes a string for case-insensitive comparison.
     *
     * @param value source string
     * @return lower-case value, or {@code null} when input is {@code null} or blank
     */
    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
