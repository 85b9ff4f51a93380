package io.github.yok.csvimporter.core;

import io.github.yok.csvimporter.schema.IdentifierRules;
import io.github.yok.csvimporter.schema.TableSchema;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational destination of an import run.
 *
 * <p>
 * Implementations wrap every database failure in a {@link DestinationException} naming the
 * operation. DDL is committed before it returns; each {@link #insertBatch} commits on success and
 * rolls back on failure, so a batch is either fully persisted or not at all.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DestinationConnector extends AutoCloseable {

    /**
     * Reads the metadata of an existing table.
     *
     * @param schema schema, or {@code null} for the connection default
     * @param table table name
     * @return table metadata, empty if the table does not exist
     * @throws DestinationException on metadata failure
     */
    Optional<TableSchema> fetchTable(String schema, String table);

    /**
     * Drops a table.
     *
     * @param schema schema, or {@code null}
     * @param table table name
     * @throws DestinationException on DDL failure
     */
    void dropTable(String schema, String table);

    /**
     * Creates a table.
     *
     * @param schema table definition
     * @throws DestinationException on DDL failure
     */
    void createTable(TableSchema schema);

    /**
     * Inserts one batch of rows in a single transaction.
     *
     * @param plan reconciled plan naming the target table and columns
     * @param rows raw rows keyed by source column name
     * @param batchIndex zero-based batch index
     * @return number of rows committed
     * @throws DestinationException if the batch could not be committed
     */
    int insertBatch(ReconciledPlan plan, List<Map<String, String>> rows, int batchIndex);

    /**
     * Identifier rules of the destination dialect.
     *
     * @return identifier rules
     */
    IdentifierRules getIdentifierRules();

    /**
     * Resolves the schema used when none was requested.
     *
     * @param requested requested schema, may be {@code null}
     * @return effective schema, may be {@code null} when the dialect has none
     */
    String resolveSchema(String requested);

    /**
     * Releases the underlying connection.
     */
    @Override
    void close();
}
