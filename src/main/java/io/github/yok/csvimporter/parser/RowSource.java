package io.github.yok.csvimporter.parser;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Sequential source of CSV rows.
 *
 * <p>
 * Each row maps every column name of {@link #getColumnNames()} to its raw text value; missing
 * values are empty strings, never {@code null}. {@link #next()} throws {@link RowSourceException}
 * on a read or parse failure, which is distinct from reaching the end of the input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowSource extends Iterator<Map<String, String>>, Closeable {

    /**
     * Column names from the header, in file order.
     *
     * @return column names
     */
    List<String> getColumnNames();
}
