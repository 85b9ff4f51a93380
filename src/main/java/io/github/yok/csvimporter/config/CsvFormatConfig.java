package io.github.yok.csvimporter.config;

import java.nio.charset.Charset;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Property class that holds how source CSV files are decoded.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code csv-importer.csv.encoding}: File encoding (e.g., {@code UTF-8})</li>
 * <li>{@code csv-importer.csv.delimiter}: Field delimiter (e.g., {@code ,} or {@code \t})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "csv-importer.csv")
@Getter
@Setter
@NoArgsConstructor
public class CsvFormatConfig {

    /**
     * Character encoding of the source file.
     */
    private String encoding = "UTF-8";

    /**
     * Field delimiter. The escape sequence {@code \t} stands for a tab.
     */
    private String delimiter = ",";

    /**
     * Resolves the configured encoding.
     *
     * @return charset
     * @throws java.nio.charset.UnsupportedCharsetException if the encoding is unknown
     */
    public Charset charset() {
        return Charset.forName(encoding);
    }

    /**
     * Resolves the configured delimiter to a single character.
     *
     * @return delimiter character
     * @throws IllegalArgumentException if the delimiter is not exactly one character
     */
    public char delimiterChar() {
        String resolved = "\\t".equals(delimiter) ? "\t" : delimiter;
        if (StringUtils.length(resolved) != 1) {
            throw new IllegalArgumentException(
                    "delimiter must be a single character: '" + delimiter + "'");
        }
        return resolved.charAt(0);
    }
}
