package io.github.yok.csvimporter.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages destination DB connection settings loaded from
 * {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: db1
 *     url: jdbc:sqlserver://localhost:1433;databaseName=staging
 *     user: loader
 *     password: password
 *     driverClass: com.microsoft.sqlserver.jdbc.SQLServerDriver
 *     schema: dbo
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Returns the entry with the given ID. When {@code id} is {@code null} and exactly one entry is
     * configured, that entry is returned.
     *
     * @param id connection ID, or {@code null}
     * @return matching entry
     * @throws IllegalArgumentException if no single entry matches
     */
    public Entry resolve(String id) {
        if (id == null) {
            if (connections.size() == 1) {
                return connections.get(0);
            }
            throw new IllegalArgumentException(
                    "--target is required when " + connections.size()
                            + " connections are configured");
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown connection id: " + id));
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "db1")
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name (optional with JDBC 4 auto-loading)
        private String driverClass;
        // Default destination schema; the dialect default applies when omitted
        private String schema;
    }
}
