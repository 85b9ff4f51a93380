/**
 * Database access.
 *
 * <p>
 * Vendor dialects render DDL and map JDBC metadata to column types; the JDBC destination inserts
 * batches through DBUnit. Dialects are selected by
 * {@link io.github.yok.csvimporter.db.DbDialectHandlerFactory} from the driver class or JDBC URL of
 * a connection entry.
 * </p>
 */
package io.github.yok.csvimporter.db;
