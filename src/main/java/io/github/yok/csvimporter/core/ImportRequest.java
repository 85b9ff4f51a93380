package io.github.yok.csvimporter.core;

import io.github.yok.csvimporter.config.ImporterConfig;
import lombok.Data;

/**
 * Parameters of one import run.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ImportRequest {

    // Destination table name, used as given (quoted, never rewritten)
    private String table;

    // Destination schema; null for the connection or dialect default
    private String schema;

    // What to do when the table exists
    private ConflictPolicy ifExists = ConflictPolicy.FAIL;

    // Rows per insert batch
    private int batchSize = ImporterConfig.DEFAULT_BATCH_SIZE;

    // Whether to infer column types from a sample
    private boolean inferTypes = true;

    // Whether failed batches are skipped instead of aborting the run
    private boolean continueOnError = false;

    // Number of leading rows sampled for inference
    private int sampleSize = ImporterConfig.DEFAULT_BATCH_SIZE;

    /**
     * Creates a request for {@code table} with the defaults from {@code config}.
     *
     * @param table destination table
     * @param config import settings
     * @return request
     */
    public static ImportRequest of(String table, ImporterConfig config) {
        ImportRequest request = new ImportRequest();
        request.setTable(table);
        request.setIfExists(config.getIfExists());
        request.setBatchSize(config.getBatchSize());
        request.setInferTypes(config.isInferTypes());
        request.setContinueOnError(config.isContinueOnError());
        request.setSampleSize(config.effectiveSampleSize());
        return request;
    }
}
