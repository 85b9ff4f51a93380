package io.github.yok.csvimporter.db;

import io.github.yok.csvimporter.config.DbUnitConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * Bundles the vendor data type factory, identifier escaping, table lookup and batched statement
 * settings so that connectors only need to call {@link #configure}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates a factory bound to the {@code dbunit.config} properties.
     *
     * @param props DBUnit settings
     */
    @Autowired
    public DbUnitConfigFactory(DbUnitConfigProperties props) {
        this.props = props;
    }

    /**
     * No-args constructor.
     *
     * <p>
     * Provides simple initialization for use outside the Spring container, using a
     * {@link DbUnitConfigProperties} instance with default values.
     * </p>
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dialect dialect of the connection
     * @param batchSize rows per JDBC batch
     */
    public void configure(DatabaseConfig cfg, DbDialectHandler dialect, int batchSize) {
        // 1) Set the data type factory
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dialect.getDataTypeFactory());
        log.debug("DBUnit: DataTypeFactory set to {}",
                dialect.getDataTypeFactory().getClass().getSimpleName());

        // 2) Escape identifiers with the dialect's quotes
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, dialect.getEscapePattern());
        log.debug("DBUnit: escape pattern = {}", dialect.getEscapePattern());

        // 3) Names are created quoted, so they are looked up exactly and with their schema
        cfg.setProperty(DatabaseConfig.FEATURE_CASE_SENSITIVE_TABLE_NAMES, Boolean.TRUE);
        cfg.setProperty(DatabaseConfig.FEATURE_QUALIFIED_TABLE_NAMES, Boolean.TRUE);
        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE,
                props.getTableTypes().toArray(new String[0]));
        cfg.setProperty(DatabaseConfig.PROPERTY_METADATA_HANDLER, dialect.getMetadataHandler());

        // 4) Configure whether to allow empty fields ("")
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        // 5) Configure whether to enable batched statements execution
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        // 6) Configure batch size
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, batchSize);
        log.debug("DBUnit: batch size = {}", batchSize);
    }
}
