package io.github.yok.csvimporter.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.TableSchema;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of reconciling the inferred schema with the destination.
 *
 * <p>
 * {@link #getTarget()} is the table the rows are written to: the inferred schema for
 * {@link Action#CREATE_NEW} and {@link Action#DROP_AND_RECREATE}, the existing table for
 * {@link Action#APPEND_INTO}. {@link #getInsertColumns()} are the target columns that receive
 * values, each paired with the CSV column it is read from via
 * {@link ColumnDefinition#getSourceName()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ReconciledPlan {

    /**
     * What has to happen to the destination before loading.
     */
    public enum Action {
        CREATE_NEW, DROP_AND_RECREATE, APPEND_INTO
    }

    private final Action action;
    private final TableSchema target;
    private final List<ColumnDefinition> insertColumns;

    private ReconciledPlan(Action action, TableSchema target,
            List<ColumnDefinition> insertColumns) {
        this.action = action;
        this.target = target;
        this.insertColumns = ImmutableList.copyOf(insertColumns);
    }

    /**
     * Plan for a table that does not exist yet.
     *
     * @param desired inferred schema
     * @return plan
     */
    public static ReconciledPlan createNew(TableSchema desired) {
        return new ReconciledPlan(Action.CREATE_NEW, desired, desired.getColumns());
    }

    /**
     * Plan that drops the existing table and creates it from the inferred schema.
     *
     * @param desired inferred schema
     * @return plan
     */
    public static ReconciledPlan dropAndRecreate(TableSchema desired) {
        return new ReconciledPlan(Action.DROP_AND_RECREATE, desired, desired.getColumns());
    }

    /**
     * Plan that inserts into the existing table.
     *
     * @param existing existing table
     * @param insertColumns existing columns fed from the CSV, in table order, with their source
     *        column names
     * @return plan
     */
    public static ReconciledPlan appendInto(TableSchema existing,
            List<ColumnDefinition> insertColumns) {
        return new ReconciledPlan(Action.APPEND_INTO, existing, insertColumns);
    }

    /**
     * Returns whether executing this plan destroys existing data.
     *
     * @return {@code true} for {@link Action#DROP_AND_RECREATE}
     */
    public boolean isDestructive() {
        return action == Action.DROP_AND_RECREATE;
    }

    /**
     * Returns whether the table must be created before loading.
     *
     * @return {@code true} unless appending
     */
    public boolean requiresCreate() {
        return action != Action.APPEND_INTO;
    }

    /**
     * Qualified name of the target table.
     *
     * @return qualified name
     */
    public String getQualifiedName() {
        return target.getQualifiedName();
    }
}
