package io.github.yok.temporalsync.config;

import io.github.yok.temporalsync.sink.ColumnDefinition;
import io.github.yok.temporalsync.sink.ColumnType;
import io.github.yok.temporalsync.sink.TableDefinition;
import io.github.yok.temporalsync.source.SourceFormat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Table synchronization jobs loaded from {@code application.yml}.
 *
 * <pre>
 * tables:
 *   - id: notas
 *     connectionId: dw
 *     table: notas
 *     naturalKey: [nota]
 *     columns:
 *       - {name: nota, type: VARCHAR, length: 12}
 *       - {name: status, type: TEXT}
 *     source:
 *       format: SAP_SPOOL
 *       path: /data/spool/notas.txt
 *       spoolCleaner: FIXED_COLUMNS
 *       requireAllColumns: true
 *       columnMap:
 *         "[Nota]": nota
 *         "[Status sistema]": status
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class TableJobConfig {

    /**
     * List of table jobs.
     */
    private List<Job> tables = new ArrayList<>();

    /**
     * Looks a job up by its id.
     *
     * @param id job id
     * @return the job, if configured
     */
    public Optional<Job> find(String id) {
        return tables.stream().filter(j -> id != null && id.equals(j.getId())).findFirst();
    }

    /**
     * One target table and the extract that feeds it.
     */
    @Data
    public static class Job {
        // Logical job id used with --tables
        private String id;
        // Connection of the target table
        private String connectionId;
        // Target table name
        private String table;
        // Natural-key column names, in key order
        private List<String> naturalKey = new ArrayList<>();
        // Business columns in declared order
        private List<Column> columns = new ArrayList<>();
        // Overrides sync.closeDeletedRows for this table when set
        private Boolean closeDeletedRows;
        // Extract settings
        private Source source = new Source();

        /**
         * Builds the table layout of this job.
         *
         * @return table definition
         * @throws IllegalArgumentException if the layout is inconsistent
         */
        public TableDefinition toTableDefinition() {
            List<ColumnDefinition> definitions = new ArrayList<>();
            for (Column column : columns) {
                definitions.add(new ColumnDefinition(column.getName(), column.getType(),
                        column.getLength()));
            }
            return new TableDefinition(table, definitions, naturalKey);
        }
    }

    /**
     * One business column.
     */
    @Data
    public static class Column {
        private String name;
        private ColumnType type = ColumnType.TEXT;
        // Maximum length, VARCHAR only
        private Integer length;
    }

    /**
     * Where and how the extract is read.
     */
    @Data
    public static class Source {
        // Extract kind; inferred from the file extension when omitted
        private SourceFormat format;
        // Extract file (CSV, SAP_SPOOL)
        private String path;
        // Field delimiter (CSV)
        private String delimiter = ",";
        // Charset name; defaults to UTF-8 for CSV and ISO-8859-1 for spools
        private String encoding;
        // Lines discarded before the header (CSV)
        private int skipRows = 0;
        // Whether the first record names the columns (CSV)
        private boolean header = true;
        // DateTimeFormatter pattern of DATE fields; ISO-8601 when omitted
        private String datePattern;
        // Cleaning strategy (SAP_SPOOL)
        private String spoolCleaner = "FIXED_COLUMNS";
        // Lines before the spool header (SAP_SPOOL, FIXED_COLUMNS)
        private Integer preambleLines;
        // Extracted column name to target column name
        private Map<String, String> columnMap = new LinkedHashMap<>();
        // Fail when the header does not provide every table column
        private boolean requireAllColumns = true;
        // Connection of the source table (TABLE)
        private String connectionId;
        // Source table, optionally schema-qualified (TABLE)
        private String table;
        // Fetch size of the source cursor (TABLE)
        private Integer fetchSize;
    }
}
