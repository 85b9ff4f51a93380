package io.github.yok.csvimporter.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import io.github.yok.csvimporter.config.ImporterConfig;
import io.github.yok.csvimporter.infer.SchemaInferencer;
import io.github.yok.csvimporter.infer.ValueClassifier;
import io.github.yok.csvimporter.parser.RowSource;
import io.github.yok.csvimporter.schema.IdentifierSanitizer;
import io.github.yok.csvimporter.schema.TableSchema;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs one CSV import: sampling, reconciliation and loading.
 *
 * <p>
 * The run is driven through {@link ImportPhase}. Sampling reads the header and up to
 * {@link ImportRequest#getSampleSize()} rows and infers the schema. Reconciliation compares it with
 * the destination, applies the conflict policy and executes the DDL; DDL is committed before any
 * row is sent. Loading replays the sampled rows followed by the rest of the file through
 * {@link BatchLoader}.
 * </p>
 *
 * <p>
 * An instance runs once. Any failure moves it to {@link ImportPhase#FAILED} and is rethrown
 * unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvImporter {

    private final DestinationConnector connector;
    private final ImporterConfig config;
    private final ReplaceConfirmation confirmation;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    // Current phase of the run
    @Getter
    private ImportPhase phase = ImportPhase.NEW;

    /**
     * Creates an importer that never asks before replacing a table.
     *
     * @param connector destination
     * @param config import settings
     */
    public CsvImporter(DestinationConnector connector, ImporterConfig config) {
        this(connector, config, ReplaceConfirmation.ALWAYS);
    }

    /**
     * Creates an importer.
     *
     * @param connector destination
     * @param config import settings
     * @param confirmation asked before a table is dropped when
     *        {@link ImporterConfig#isConfirmBeforeReplace()} is set
     */
    public CsvImporter(DestinationConnector connector, ImporterConfig config,
            ReplaceConfirmation confirmation) {
        this.connector = connector;
        this.config = config;
        this.confirmation = confirmation;
    }

    /**
     * Requests the load to stop before its next batch.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    /**
     * Imports every row of {@code source}.
     *
     * <p>
     * The source is not closed.
     * </p>
     *
     * @param request import parameters
     * @param source rows to import
     * @return what was persisted
     * @throws IllegalStateException if this importer has already run
     * @throws TableExistsException if the table exists and the policy is FAIL
     * @throws SchemaMismatchException if appending into an incompatible table
     * @throws BatchLoadException in fail-fast mode when a batch fails
     * @throws SourceReadException when the file cannot be read further while loading
     * @throws DestinationException on metadata or DDL failure
     */
    public LoadSummary run(ImportRequest request, RowSource source) {
        moveTo(ImportPhase.SAMPLING);
        try {
            Preconditions.checkArgument(StringUtils.isNotBlank(request.getTable()),
                    "table name is required");
            String schema = connector.resolveSchema(request.getSchema());
            String qualified = TableSchema.qualify(schema, request.getTable());

            List<String> columnNames = source.getColumnNames();
            if (columnNames.isEmpty()) {
                throw new CsvImportException(qualified, "CSV file has no header columns");
            }
            List<Map<String, String>> sample = new ArrayList<>();
            if (request.isInferTypes()) {
                while (sample.size() < request.getSampleSize() && source.hasNext()) {
                    sample.add(source.next());
                }
            }
            SchemaInferencer inferencer = new SchemaInferencer(new ValueClassifier(),
                    new IdentifierSanitizer(connector.getIdentifierRules()), config);
            TableSchema desired = inferencer.infer(schema, request.getTable(), sample,
                    columnNames, request.isInferTypes());

            moveTo(ImportPhase.RECONCILING);
            Optional<TableSchema> existing = connector.fetchTable(schema, request.getTable());
            ReconciledPlan plan =
                    new SchemaReconciler().reconcile(desired, existing, request.getIfExists());
            execute(plan);

            moveTo(ImportPhase.LOADING);
            Iterator<Map<String, String>> rows = Iterators.concat(sample.iterator(), source);
            LoadSummary summary = new BatchLoader(connector, config.getMaxRecordedFailures())
                    .load(rows, plan, request.getBatchSize(), request.isContinueOnError(),
                            cancelRequested::get);

            moveTo(ImportPhase.COMPLETED);
            log.info("Import into {} completed: {}", qualified, summary);
            return summary;
        } catch (RuntimeException e) {
            phase = ImportPhase.FAILED;
            throw e;
        }
    }

    private void execute(ReconciledPlan plan) {
        TableSchema target = plan.getTarget();
        TableSchema created = plan.requiresCreate() ? withIdentityColumn(target) : target;
        if (plan.isDestructive()) {
            log.warn("Table {} will be DROPPED and recreated; its existing rows are lost",
                    plan.getQualifiedName());
            if (config.isConfirmBeforeReplace() && !confirmation.confirm(plan)) {
                throw new CsvImportException(plan.getQualifiedName(),
                        "Replacing table " + plan.getQualifiedName() + " was not confirmed");
            }
            connector.dropTable(target.getSchema(), target.getTableName());
        }
        if (plan.requiresCreate()) {
            connector.createTable(created);
        }
    }

    private TableSchema withIdentityColumn(TableSchema target) {
        if (!config.isAddIdentityColumn()) {
            return target;
        }
        String name = config.getIdentityColumnName();
        if (StringUtils.isBlank(name) || target.findColumn(name).isPresent()) {
            throw new CsvImportException(target.getQualifiedName(), "Identity column '" + name
                    + "' is blank or collides with a CSV column");
        }
        log.info("Table {} gets generated key column '{}'", target.getQualifiedName(), name);
        return target.withIdentityColumn(name);
    }

    private void moveTo(ImportPhase next) {
        if (!phase.canMoveTo(next)) {
            throw new IllegalStateException("Cannot move from " + phase + " to " + next);
        }
        log.debug("Phase {} -> {}", phase, next);
        phase = next;
    }
}
