package io.github.yok.csvimporter.config;

import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} for bulk inserts.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: Whether empty fields are allowed</li>
 * <li>{@code dbunit.config.batched-statements}: Whether to use batched statement execution</li>
 * <li>{@code dbunit.config.table-types}: JDBC table types searched when DBUnit resolves the
 * destination table</li>
 * </ul>
 *
 * <p>
 * The JDBC batch size always follows the import batch size so that one import batch is sent as one
 * JDBC batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Specifies whether DBUnit permits empty fields (i.e., {@code ""}).
     */
    private boolean allowEmptyFields = true;

    /**
     * Specifies whether DBUnit's batched statement execution should be enabled.
     */
    private boolean batchedStatements = true;

    /**
     * JDBC metadata table types DBUnit considers. H2 2.x reports regular tables as
     * {@code BASE TABLE}.
     */
    private List<String> tableTypes = List.of("TABLE", "BASE TABLE");
}
