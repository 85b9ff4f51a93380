package io.github.yok.csvimporter;

import io.github.yok.csvimporter.config.ConnectionConfig;
import io.github.yok.csvimporter.config.CsvFormatConfig;
import io.github.yok.csvimporter.config.ImporterConfig;
import io.github.yok.csvimporter.core.CsvImporter;
import io.github.yok.csvimporter.core.ImportRequest;
import io.github.yok.csvimporter.core.LoadSummary;
import io.github.yok.csvimporter.core.ReplaceConfirmation;
import io.github.yok.csvimporter.db.DbDialectHandler;
import io.github.yok.csvimporter.db.DbDialectHandlerFactory;
import io.github.yok.csvimporter.db.DbUnitConfigFactory;
import io.github.yok.csvimporter.db.JdbcDestinationConnector;
import io.github.yok.csvimporter.parser.CsvRowSource;
import io.github.yok.csvimporter.util.ErrorHandler;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command line into {@link ImportArguments}, opens the target connection and runs one
 * {@link CsvImporter}. See {@link ImportArguments} for the options.
 * </p>
 *
 * <p>
 * The process exit code is {@code 0} when every row was committed, {@link #EXIT_PARTIAL} when the
 * load finished with skipped batches or was cancelled, and {@link ErrorHandler#EXIT_FAILURE} on a
 * fatal error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ImporterConfig
 * @see ConnectionConfig
 * @see DbDialectHandlerFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    /**
     * Exit code of a load that committed only part of the rows.
     */
    public static final int EXIT_PARTIAL = 2;

    private final ImporterConfig importerConfig;
    private final CsvFormatConfig csvFormatConfig;
    private final ConnectionConfig connectionConfig;
    private final DbDialectHandlerFactory dialectFactory;
    private final DbUnitConfigFactory dbUnitConfigFactory;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        try {
            ImportArguments arguments = ImportArguments.parse(args);
            ConnectionConfig.Entry entry = connectionConfig.resolve(arguments.getTarget());
            ImportRequest request = arguments.toRequest(importerConfig);
            CsvFormatConfig format = arguments.toFormat(csvFormatConfig);
            log.info("Importing {} into table {} on [{}] (if-exists={}, batch-size={})",
                    arguments.getFile(), request.getTable(), entry.getId(),
                    request.getIfExists(), request.getBatchSize());

            LoadSummary summary = importFile(arguments, entry, request, format);
            exitCode = summary.isComplete() ? 0 : EXIT_PARTIAL;
        } catch (Exception e) {
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private LoadSummary importFile(ImportArguments arguments, ConnectionConfig.Entry entry,
            ImportRequest request, CsvFormatConfig format) throws Exception {
        Charset charset = format.charset();
        char delimiter = format.delimiterChar();
        DbDialectHandler dialect = dialectFactory.create(entry);
        try (JdbcDestinationConnector connector = JdbcDestinationConnector.open(entry, dialect,
                dbUnitConfigFactory, request.getBatchSize());
                CsvRowSource source = new CsvRowSource(arguments.getFile(), charset, delimiter)) {
            LoadSummary summary =
                    new CsvImporter(connector, importerConfig, confirmation()).run(request, source);
            log.info("Rows read: {}, inserted: {}, skipped: {}, batches: {} committed / {} failed,"
                    + " elapsed: {} ms ({} rows/sec)", summary.getRowsRead(),
                    summary.getInsertedRows(), summary.getSkippedRows(),
                    summary.getCommittedBatches(), summary.getFailedBatches(),
                    summary.getElapsedMillis(), String.format("%.1f", summary.rowsPerSecond()));
            summary.getFailures().forEach(f -> log.warn("Skipped batch {} (rows {}-{}): {}",
                    f.getBatchIndex(), f.getFirstRow(), f.getLastRow(), f.getReason()));
            if (summary.isCancelled()) {
                log.warn("Import was cancelled before all rows were loaded");
            }
            return summary;
        }
    }

    private ReplaceConfirmation confirmation() {
        if (!importerConfig.isConfirmBeforeReplace()) {
            return ReplaceConfirmation.ALWAYS;
        }
        return new ConsoleReplaceConfirmation(
                new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())),
                System.out);
    }
}
