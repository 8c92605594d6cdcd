package io.github.yok.temporalsync.config;

import io.github.yok.temporalsync.core.SyncOptions;
import io.github.yok.temporalsync.sink.SystemColumns;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Run defaults shared by all table jobs, bound from the {@code sync} section.
 *
 * <pre>
 * sync:
 *   chunkSize: 5000
 *   closeDeletedRows: true
 *   sentinelValidTo: 2999-12-31
 *   duplicateKeyPolicy: FAIL
 *   serializable: true
 *   idColumn: id
 *   validFromColumn: valid_from
 *   validToColumn: valid_to
 * </pre>
 */
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    // Pending inserts flushed per batch; also the fetch size of the cache scan
    private int chunkSize = SyncOptions.DEFAULT_CHUNK_SIZE;

    // Close current versions whose key is missing from the extract
    private boolean closeDeletedRows = true;

    // valid_to of current versions (yyyy-MM-dd)
    private String sentinelValidTo = SyncOptions.DEFAULT_SENTINEL_VALID_TO.toString();

    // Handling of repeated natural keys in one extract
    private DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.FAIL;

    // Request SERIALIZABLE isolation for each job transaction
    private boolean serializable = true;

    private String idColumn = SystemColumns.DEFAULT.getIdColumn();
    private String validFromColumn = SystemColumns.DEFAULT.getValidFromColumn();
    private String validToColumn = SystemColumns.DEFAULT.getValidToColumn();

    /**
     * Parses {@link #sentinelValidTo}.
     *
     * @return sentinel date
     * @throws IllegalStateException if the value is not an ISO date
     */
    public LocalDate sentinelDate() {
        try {
            return LocalDate.parse(sentinelValidTo.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "sync.sentinelValidTo is not a yyyy-MM-dd date: " + sentinelValidTo, e);
        }
    }

    public SystemColumns systemColumns() {
        return new SystemColumns(idColumn, validFromColumn, validToColumn);
    }

    /**
     * Builds the options of one table job.
     *
     * @param job table job; its own {@code closeDeletedRows} overrides the shared default
     * @param asOf as-of date of the run
     * @return run options
     * @throws IllegalArgumentException if the table layout of the job is inconsistent
     */
    public SyncOptions toOptions(TableJobConfig.Job job, LocalDate asOf) {
        boolean closeDeleted =
                job.getCloseDeletedRows() != null ? job.getCloseDeletedRows() : closeDeletedRows;
        return SyncOptions.builder()
                .naturalKey(job.toTableDefinition().getNaturalKey())
                .asOf(asOf)
                .chunkSize(chunkSize)
                .closeDeletedRows(closeDeleted)
                .sentinelValidTo(sentinelDate())
                .duplicateKeyPolicy(duplicateKeyPolicy)
                .systemColumns(systemColumns())
                .build();
    }
}
