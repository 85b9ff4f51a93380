package io.github.yok.csvimporter.infer;

import io.github.yok.csvimporter.config.ImporterConfig;
import io.github.yok.csvimporter.schema.ColumnDefinition;
import io.github.yok.csvimporter.schema.ColumnType;
import io.github.yok.csvimporter.schema.IdentifierSanitizer;
import io.github.yok.csvimporter.schema.TableSchema;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives a {@link TableSchema} from a bounded sample of CSV rows.
 *
 * <p>
 * Every value is classified by {@link ValueClassifier} and folded into one
 * {@link ColumnObservation} per column. Each observation is then reduced to a single
 * {@link ColumnType}:
 * </p>
 * <ul>
 * <li>only empty values: {@code VARCHAR(255)}, or longer when a blank value is longer, marked
 * untyped;</li>
 * <li>boolean words, optionally mixed with {@code 0}/{@code 1}: {@code BOOLEAN};</li>
 * <li>integers only: the narrowest of {@code SMALLINT}, {@code INT}, {@code BIGINT} holding the
 * observed range, {@code DECIMAL(n, 0)} beyond 64 bits;</li>
 * <li>integers and fractional numbers: {@code FLOAT} up to 15 digits, else
 * {@code DECIMAL(p, s)};</li>
 * <li>temporal values only: the finest granularity observed;</li>
 * <li>any other mix: text long enough for the longest raw value (blank values included, since text
 * columns store them verbatim), rounded up to a bucket, or
 * unbounded text above {@link ImporterConfig#getVarcharMaxLength()}.</li>
 * </ul>
 *
 * <p>
 * The sample is a heuristic. Values after the sample may not fit the inferred type; such rows fail
 * at insert time and are reported per batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaInferencer {

    /**
     * Type of columns whose sampled values are all empty.
     */
    public static final ColumnType EMPTY_COLUMN_TYPE = ColumnType.varchar(255);

    private static final int[] VARCHAR_BUCKETS = {16, 32, 64, 128, 255, 512, 1024, 2048, 4000};
    private static final BigInteger SHORT_MIN = BigInteger.valueOf(Short.MIN_VALUE);
    private static final BigInteger SHORT_MAX = BigInteger.valueOf(Short.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final ValueClassifier classifier;
    private final IdentifierSanitizer sanitizer;
    private final ImporterConfig config;

    /**
     * Creates an inferencer.
     *
     * @param classifier per-value classifier
     * @param sanitizer identifier sanitizer of the destination dialect
     * @param config import settings (text length limits)
     */
    public SchemaInferencer(ValueClassifier classifier, IdentifierSanitizer sanitizer,
            ImporterConfig config) {
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.config = config;
    }

    /**
     * Infers the destination schema.
     *
     * @param schema destination schema, may be {@code null}
     * @param tableName destination table name
     * @param sampleRows sampled rows, keyed by source column name
     * @param columnNames source column names in file order
     * @param inferEnabled {@code false} to type every column as text without sampling
     * @return inferred schema with sanitized column names
     */
    public TableSchema infer(String schema, String tableName, List<Map<String, String>> sampleRows,
            List<String> columnNames, boolean inferEnabled) {
        List<String> names = sanitizer.sanitizeAll(columnNames);
        Map<String, ColumnObservation> observations = null;
        ColumnType defaultType = null;
        if (inferEnabled) {
            log.info("Inferring column types from {} sampled rows", sampleRows.size());
            observations = observe(sampleRows, columnNames);
        } else {
            defaultType = defaultType();
            log.info("Type inference disabled; all columns use {}", defaultType);
        }

        List<ColumnDefinition> columns = new ArrayList<>(columnNames.size());
        for (int i = 0; i < columnNames.size(); i++) {
            String source = columnNames.get(i);
            ColumnDefinition column;
            if (observations == null) {
                column = ColumnDefinition.untyped(names.get(i), source, defaultType);
            } else {
                ColumnObservation observation = observations.get(source);
                ColumnType type = resolve(observation);
                column = observation.nonNullCount() == 0
                        ? ColumnDefinition.untyped(names.get(i), source, type)
                        : ColumnDefinition.inferred(names.get(i), source, type);
                log.info("Column '{}' inferred as {}", names.get(i), type);
            }
            columns.add(column);
        }
        return new TableSchema(schema, tableName, columns);
    }

    /**
     * Observes every sampled value of every column.
     *
     * @param sampleRows sampled rows
     * @param columnNames column names in file order
     * @return frozen observations, keyed by column name in file order
     */
    public Map<String, ColumnObservation> observe(List<Map<String, String>> sampleRows,
            List<String> columnNames) {
        Map<String, ColumnObservation> observations = new LinkedHashMap<>();
        for (String name : columnNames) {
            observations.put(name, new ColumnObservation(name));
        }
        for (Map<String, String> row : sampleRows) {
            for (String name : columnNames) {
                observations.get(name).accept(classifier.classify(row.get(name)));
            }
        }
        observations.values().forEach(ColumnObservation::freeze);
        return observations;
    }

    /**
     * Reduces one observation to a column type.
     *
     * @param observation frozen observation
     * @return resolved type
     */
    public ColumnType resolve(ColumnObservation observation) {
        if (observation.nonNullCount() == 0) {
            int blank = observation.getMaxBlankLength();
            return blank > EMPTY_COLUMN_TYPE.getLength() ? textType(blank) : EMPTY_COLUMN_TYPE;
        }
        if (observation.count(ValueKind.BOOLEAN) > 0
                && observation.onlyKinds(ValueKind.BOOLEAN, ValueKind.INTEGER)
                && !observation.isNonBooleanIntegerSeen()) {
            return ColumnType.booleanType();
        }
        if (observation.onlyKinds(ValueKind.INTEGER)) {
            ColumnType type = integerType(observation);
            if (type != null) {
                return type;
            }
        } else if (observation.onlyKinds(ValueKind.INTEGER, ValueKind.FLOAT, ValueKind.DECIMAL)) {
            ColumnType type = fractionalType(observation);
            if (type != null) {
                return type;
            }
        } else if (observation.onlyKinds(ValueKind.DATE, ValueKind.DATETIME,
                ValueKind.DATETIME_WITH_FRACTION)) {
            return temporalType(observation);
        }
        if (observation.isHypothesisBroken()) {
            log.debug("Column '{}' has mixed value kinds; falling back to text",
                    observation.getColumnName());
        }
        return textType(Math.max(observation.getMaxLength(), observation.getMaxBlankLength()));
    }

    /**
     * Rounds a text length up to the next bucket.
     *
     * @param maxLength longest observed length
     * @return bounded text type, or unbounded text above the configured ceiling
     */
    public ColumnType textType(int maxLength) {
        int ceiling = config.getVarcharMaxLength();
        if (maxLength > ceiling) {
            return ColumnType.varcharMax();
        }
        for (int bucket : VARCHAR_BUCKETS) {
            if (bucket >= maxLength && bucket <= ceiling) {
                return ColumnType.varchar(bucket);
            }
        }
        return ColumnType.varchar(ceiling);
    }

    private ColumnType defaultType() {
        return config.getDefaultTextLength() > 0 ? ColumnType.varchar(config.getDefaultTextLength())
                : ColumnType.varcharMax();
    }

    private ColumnType integerType(ColumnObservation observation) {
        BigInteger min = observation.getMinInteger();
        BigInteger max = observation.getMaxInteger();
        if (min.compareTo(SHORT_MIN) >= 0 && max.compareTo(SHORT_MAX) <= 0) {
            return ColumnType.smallInt();
        }
        if (min.compareTo(INT_MIN) >= 0 && max.compareTo(INT_MAX) <= 0) {
            return ColumnType.integer();
        }
        if (min.compareTo(LONG_MIN) >= 0 && max.compareTo(LONG_MAX) <= 0) {
            return ColumnType.bigInt();
        }
        int digits = observation.getMaxIntegerDigits();
        return digits <= ColumnType.MAX_DECIMAL_PRECISION ? ColumnType.decimal(digits, 0) : null;
    }

    private ColumnType fractionalType(ColumnObservation observation) {
        int scale = observation.getMaxScale();
        int precision = Math.max(1, observation.getMaxIntegerDigits() + scale);
        if (precision <= ValueClassifier.FLOAT_MAX_DIGITS) {
            return ColumnType.floatType();
        }
        if (precision <= ColumnType.MAX_DECIMAL_PRECISION) {
            return ColumnType.decimal(precision, scale);
        }
        return null;
    }

    private ColumnType temporalType(ColumnObservation observation) {
        if (observation.count(ValueKind.DATETIME_WITH_FRACTION) > 0) {
            return ColumnType.dateTimeWithFraction();
        }
        if (observation.count(ValueKind.DATETIME) > 0) {
            return ColumnType.dateTime();
        }
        return ColumnType.date();
    }
}
