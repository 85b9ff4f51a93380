package io.github.yok.csvimporter;

import com.google.common.base.Preconditions;
import io.github.yok.csvimporter.config.CsvFormatConfig;
import io.github.yok.csvimporter.config.ImporterConfig;
import io.github.yok.csvimporter.core.ConflictPolicy;
import io.github.yok.csvimporter.core.ImportRequest;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Command-line options of one import.
 *
 * <p>
 * Options left unset fall back to the {@code csv-importer} settings in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code --file/-f <path>}: source file (required)</li>
 * <li>{@code --table/-t <name>}: destination table (required)</li>
 * <li>{@code --schema/-s <name>}: destination schema</li>
 * <li>{@code --if-exists <fail|replace|append>}</li>
 * <li>{@code --batch-size <n>}</li>
 * <li>{@code --infer-types} / {@code --no-infer-types}</li>
 * <li>{@code --encoding <charset>}</li>
 * <li>{@code --delimiter <char>} ({@code \t} for tab)</li>
 * <li>{@code --continue-on-error}</li>
 * <li>{@code --target <connection id>}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class ImportArguments {

    private Path file;
    private String table;
    private String schema;
    private ConflictPolicy ifExists;
    private Integer batchSize;
    private Boolean inferTypes;
    private String encoding;
    private String delimiter;
    private boolean continueOnError;
    private String target;

    private ImportArguments() {}

    /**
     * Parses command-line arguments. Unknown arguments are logged and ignored.
     *
     * @param args command-line arguments
     * @return parsed options
     * @throws IllegalArgumentException if a required option is missing or a value is invalid
     */
    public static ImportArguments parse(String... args) {
        ImportArguments parsed = new ImportArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--file":
                case "-f":
                    parsed.file = Paths.get(value(args, ++i, arg));
                    break;
                case "--table":
                case "-t":
                    parsed.table = value(args, ++i, arg);
                    break;
                case "--schema":
                case "-s":
                    parsed.schema = value(args, ++i, arg);
                    break;
                case "--if-exists":
                    parsed.ifExists = ConflictPolicy.parse(value(args, ++i, arg));
                    break;
                case "--batch-size":
                    parsed.batchSize = positiveInt(value(args, ++i, arg), arg);
                    break;
                case "--infer-types":
                    parsed.inferTypes = Boolean.TRUE;
                    break;
                case "--no-infer-types":
                    parsed.inferTypes = Boolean.FALSE;
                    break;
                case "--encoding":
                    parsed.encoding = value(args, ++i, arg);
                    break;
                case "--delimiter":
                    parsed.delimiter = value(args, ++i, arg);
                    break;
                case "--continue-on-error":
                    parsed.continueOnError = true;
                    break;
                case "--target":
                    parsed.target = value(args, ++i, arg).trim();
                    break;
                default:
                    log.warn("Unknown argument: {}", arg);
            }
        }
        Preconditions.checkArgument(parsed.file != null, "--file is required");
        Preconditions.checkArgument(StringUtils.isNotBlank(parsed.table), "--table is required");
        return parsed;
    }

    /**
     * Builds the import request: these options over the configured defaults.
     *
     * @param config configured defaults
     * @return request
     */
    public ImportRequest toRequest(ImporterConfig config) {
        ImportRequest request = ImportRequest.of(table, config);
        request.setSchema(StringUtils.trimToNull(schema));
        if (ifExists != null) {
            request.setIfExists(ifExists);
        }
        if (batchSize != null) {
            request.setBatchSize(batchSize);
            if (config.getSampleSize() <= 0) {
                request.setSampleSize(batchSize);
            }
        }
        if (inferTypes != null) {
            request.setInferTypes(inferTypes);
        }
        if (continueOnError) {
            request.setContinueOnError(true);
        }
        return request;
    }

    /**
     * Builds the CSV decoding settings: these options over the configured defaults.
     *
     * @param defaults configured defaults
     * @return new settings; {@code defaults} is left unchanged
     */
    public CsvFormatConfig toFormat(CsvFormatConfig defaults) {
        CsvFormatConfig format = new CsvFormatConfig();
        format.setEncoding(encoding != null ? encoding : defaults.getEncoding());
        format.setDelimiter(delimiter != null ? delimiter : defaults.getDelimiter());
        return format;
    }

    private static String value(String[] args, int index, String option) {
        Preconditions.checkArgument(index < args.length, "%s requires a value", option);
        return args[index];
    }

    private static int positiveInt(String text, String option) {
        int parsed;
        try {
            parsed = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be an integer: " + text, e);
        }
        Preconditions.checkArgument(parsed > 0, "%s must be positive: %s", option, parsed);
        return parsed;
    }
}
