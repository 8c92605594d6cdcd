package io.github.yok.temporalsync.config;

import io.github.yok.temporalsync.sink.SqlDialect;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Database connection settings loaded from {@code application.yml}.
 *
 * <pre>
 * connections:
 *   - id: dw
 *     url: jdbc:postgresql://localhost:5432/dw
 *     user: etl
 *     password: secret
 *     driverClass: org.postgresql.Driver
 *     dialect: POSTGRESQL
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections;

    /**
     * Looks a connection up by its id.
     *
     * @param id logical connection id
     * @return the entry, if configured
     */
    public Optional<Entry> find(String id) {
        if (connections == null || id == null) {
            return Optional.empty();
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the connection (e.g., "dw")
        private String id;
        // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/dw)
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
        // SQL dialect; derived from the URL when omitted
        private SqlDialect dialect;

        /**
         * Returns the configured dialect, or the one implied by the URL.
         *
         * @return SQL dialect
         * @throws IllegalArgumentException if no dialect is set and the URL is not recognized
         */
        public SqlDialect resolveDialect() {
            return dialect != null ? dialect : SqlDialect.fromJdbcUrl(url);
        }
    }
}
