package io.github.yok.csvimporter.parser;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.input.BOMInputStream;

/**
 * {@link RowSource} over a delimited text file, backed by Apache Commons CSV.
 *
 * <p>
 * The first record is the header. Values are returned exactly as read (no trimming); quoted fields
 * may contain delimiters and line breaks. Records shorter than the header are padded with empty
 * strings, extra trailing fields are ignored. A leading byte order mark is skipped. Duplicate
 * header names, blank ones included, are rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvRowSource implements RowSource {

    private final String description;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> columnNames;
    private boolean extraFieldsWarned;

    /**
     * Opens a CSV file.
     *
     * @param file CSV file
     * @param charset file encoding
     * @param delimiter field delimiter
     * @throws RowSourceException if the file cannot be opened or its header is invalid
     */
    public CsvRowSource(Path file, Charset charset, char delimiter) {
        this(file.toString(), open(file), charset, delimiter);
    }

    /**
     * Reads CSV from a stream. The stream is closed by {@link #close()}.
     *
     * @param description name used in messages
     * @param in CSV bytes
     * @param charset encoding
     * @param delimiter field delimiter
     * @throws RowSourceException if the header cannot be read or is invalid
     */
    public CsvRowSource(String description, InputStream in, Charset charset, char delimiter) {
        this.description = description;
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader()
                .setSkipHeaderRecord(true).setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
                .setIgnoreSurroundingSpaces(false).setTrim(false).get();
        try {
            Reader reader = new InputStreamReader(stripBom(in), charset);
            this.parser = CSVParser.parse(reader, format);
        } catch (IOException | UncheckedIOException e) {
            closeQuietly(in, e);
            throw new RowSourceException(description, "Failed to read CSV header", e);
        } catch (IllegalArgumentException e) {
            closeQuietly(in, e);
            throw new RowSourceException(description, "Invalid CSV header: " + e.getMessage(), e);
        }
        this.columnNames = ImmutableList.copyOf(parser.getHeaderNames());
        this.records = parser.iterator();
        log.info("Opened CSV {} (columns={})", description, columnNames);
    }

    @Override
    public List<String> getColumnNames() {
        return columnNames;
    }

    @Override
    public boolean hasNext() {
        try {
            return records.hasNext();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new RowSourceException(description,
                    "Failed to read CSV at record " + (parser.getRecordNumber() + 1), e);
        }
    }

    @Override
    public Map<String, String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        CSVRecord record;
        try {
            record = records.next();
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new RowSourceException(description,
                    "Failed to read CSV at record " + (parser.getRecordNumber() + 1), e);
        }
        if (record.size() > columnNames.size() && !extraFieldsWarned) {
            log.warn("CSV {} line {} has {} fields but the header has {}; extra fields ignored",
                    description, parser.getCurrentLineNumber(), record.size(),
                    columnNames.size());
            extraFieldsWarned = true;
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            row.put(columnNames.get(i), i < record.size() ? record.get(i) : "");
        }
        return row;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private static InputStream open(Path file) {
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new RowSourceException(file.toString(), "Cannot open CSV file", e);
        }
    }

    private static void closeQuietly(InputStream in, Exception primary) {
        try {
            in.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    private static InputStream stripBom(InputStream in) throws IOException {
        return BOMInputStream.builder().setInputStream(in).get();
    }
}
