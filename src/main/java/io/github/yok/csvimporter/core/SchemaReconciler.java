package io.github.yok.csvimporter.core;

import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.TableSchema;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides how the inferred schema is applied to the destination under a {@link ConflictPolicy}.
 *
 * <p>
 * Reconciliation is pure: it inspects metadata only and never issues DDL. Failures are raised
 * before anything has been sent to the destination.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaReconciler {

    /**
     * Reconciles the inferred schema with the existing table, if any.
     *
     * @param desired inferred schema
     * @param existing existing table metadata, empty if the table does not exist
     * @param policy conflict policy
     * @return plan to execute
     * @throws TableExistsException if the table exists and {@code policy} is FAIL
     * @throws SchemaMismatchException if appending and a column is missing or cannot hold the
     *         inferred type
     */
    public ReconciledPlan reconcile(TableSchema desired, Optional<TableSchema> existing,
            ConflictPolicy policy) {
        if (existing.isEmpty()) {
            log.info("Table {} does not exist; it will be created", desired.getQualifiedName());
            return ReconciledPlan.createNew(desired);
        }
        switch (policy) {
            case FAIL:
                throw new TableExistsException(desired.getQualifiedName());
            case REPLACE:
                log.info("Table {} exists; it will be dropped and recreated",
                        desired.getQualifiedName());
                return ReconciledPlan.dropAndRecreate(desired);
            case APPEND:
                return append(desired, existing.get());
            default:
                throw new IllegalArgumentException("Unsupported policy: " + policy);
        }
    }

    private ReconciledPlan append(TableSchema desired, TableSchema existing) {
        String table = existing.getQualifiedName();
        Map<String, ColumnDefinition> bySourceColumn = new HashMap<>();
        for (ColumnDefinition wanted : desired.getColumns()) {
            ColumnDefinition actual = existing.findColumn(wanted.getName())
                    .orElseThrow(() -> new SchemaMismatchException(table, wanted.getName(),
                            wanted.describeType(), null));
            if (actual.getType() == null || !fits(wanted, actual)) {
                throw new SchemaMismatchException(table, wanted.getName(), wanted.describeType(),
                        actual.describeType());
            }
            bySourceColumn.put(actual.getName().toLowerCase(Locale.ROOT), wanted);
        }

        List<ColumnDefinition> insertColumns = new ArrayList<>();
        for (ColumnDefinition actual : existing.getColumns()) {
            ColumnDefinition wanted = bySourceColumn.get(actual.getName().toLowerCase(Locale.ROOT));
            if (wanted == null) {
                log.info("Column '{}' of {} is not in the CSV and will be left empty",
                        actual.getName(), table);
                continue;
            }
            insertColumns.add(new ColumnDefinition(actual.getName(), wanted.getSourceName(),
                    actual.getType(), actual.getDeclaredTypeName()));
        }
        log.info("Appending {} columns into existing table {}", insertColumns.size(), table);
        return ReconciledPlan.appendInto(existing, insertColumns);
    }

    private static boolean fits(ColumnDefinition wanted, ColumnDefinition actual) {
        if (wanted.isUntyped()) {
            log.debug("Column '{}' has no sampled type; accepting existing type {}",
                    wanted.getName(), actual.describeType());
            return true;
        }
        return wanted.getType().isRepresentableIn(actual.getType());
    }
}
