package io.github.yok.csvimporter.config;

import io.github.yok.csvimporter.core.ConflictPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code csv-importer} section in {@code application.yml}.
 * Holds the defaults of an import run; command-line options override them per run.
 *
 * <pre>
 * csv-importer:
 *   batch-size: 1000
 *   sample-size: 1000
 *   infer-types: true
 *   if-exists: fail
 *   continue-on-error: false
 *   max-recorded-failures: 100
 *   varchar-max-length: 4000
 *   default-text-length: 0
 *   confirm-before-replace: false
 *   add-identity-column: false
 *   identity-column-name: Id
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "csv-importer")
@Data
public class ImporterConfig {

    /**
     * Default number of rows per bulk insert.
     */
    public static final int DEFAULT_BATCH_SIZE = 1000;

    /**
     * Number of rows per bulk insert.
     */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Number of leading rows examined for type inference. A value of {@code 0} or less uses
     * {@link #batchSize}.
     */
    private int sampleSize = 1000;

    /**
     * When {@code false}, every column is created as text without sampling.
     */
    private boolean inferTypes = true;

    /**
     * Behavior when the destination table already exists.
     */
    private ConflictPolicy ifExists = ConflictPolicy.FAIL;

    /**
     * When {@code true}, a failed batch is skipped and the load proceeds with the next batch.
     */
    private boolean continueOnError = false;

    /**
     * Maximum number of batch failures kept in the load summary. Further failures are only
     * counted.
     */
    private int maxRecordedFailures = 100;

    /**
     * Longest inferred bounded text type; longer values make the column unbounded.
     */
    private int varcharMaxLength = 4000;

    /**
     * Text length used for every column when inference is disabled. {@code 0} means unbounded
     * text.
     */
    private int defaultTextLength = 0;

    /**
     * When {@code true}, the user is prompted before an existing table is dropped. Defaults to
     * {@code false} (a warning is logged instead).
     */
    private boolean confirmBeforeReplace = false;

    /**
     * When {@code true}, tables created by the import get a leading auto-generated integer primary
     * key that is not filled from the CSV.
     */
    private boolean addIdentityColumn = false;

    /**
     * Name of the generated key column added when {@link #addIdentityColumn} is set.
     */
    private String identityColumnName = "Id";

    /**
     * Returns the effective sample size.
     *
     * @return {@link #sampleSize} when positive, otherwise {@link #batchSize}
     */
    public int effectiveSampleSize() {
        return sampleSize > 0 ? sampleSize : batchSize;
    }
}
