package io.github.yok.csvimporter.config;

/**
 * Supported destination database products.
 *
 * <p>
 * Selects the dialect handler and the DBUnit {@code IDataTypeFactory} used for a connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    ORACLE, POSTGRESQL, MYSQL, SQLSERVER, H2
}
