package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.config.ConnectionConfig;
import io.github.yok.temporalsync.config.SyncConfig;
import io.github.yok.temporalsync.config.TableJobConfig;
import io.github.yok.temporalsync.sink.JdbcVersionedTableSink;
import io.github.yok.temporalsync.sink.SqlDialect;
import io.github.yok.temporalsync.sink.TableDefinition;
import io.github.yok.temporalsync.source.RowSource;
import io.github.yok.temporalsync.source.RowSourceFactory;
import io.github.yok.temporalsync.source.SourceFormat;
import io.github.yok.temporalsync.util.ErrorHandler;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs the configured table jobs, one transaction per table.
 *
 * <p>
 * For each targeted job the runner:
 * </p>
 * <ol>
 * <li>opens the target connection with auto-commit off, requesting {@code SERIALIZABLE} isolation
 * when {@code sync.serializable} is set;</li>
 * <li>creates the versioned table when it is missing;</li>
 * <li>opens the extract (file, spool or source table) and synchronizes the table;</li>
 * <li>commits, or rolls back and reports the failure through {@link ErrorHandler}.</li>
 * </ol>
 *
 * <p>
 * A failed job does not stop the following ones. A summary of all jobs is logged at the end.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SyncJobRunner {

    /**
     * Opens JDBC connections (replaceable in tests).
     */
    interface ConnectionProvider {

        Connection open(ConnectionConfig.Entry entry) throws SQLException, ClassNotFoundException;
    }

    // Holder of JDBC connection settings
    private final ConnectionConfig connectionConfig;

    // sync.* defaults shared by all jobs
    private final SyncConfig syncConfig;

    // Table jobs
    private final TableJobConfig tableJobConfig;

    private final ConnectionProvider connectionProvider;

    private final TemporalTableSynchronizer synchronizer;

    // Job id → summary of a committed run
    private final Map<String, SyncSummary> summaries = new LinkedHashMap<>();

    // Job ids whose run failed
    private final List<String> failedJobs = new ArrayList<>();

    /**
     * Creates a runner that connects through {@link DriverManager}.
     *
     * @param connectionConfig connections
     * @param syncConfig shared run settings
     * @param tableJobConfig table jobs
     */
    public SyncJobRunner(ConnectionConfig connectionConfig, SyncConfig syncConfig,
            TableJobConfig tableJobConfig) {
        this(connectionConfig, syncConfig, tableJobConfig, entry -> {
            if (StringUtils.isNotBlank(entry.getDriverClass())) {
                Class.forName(entry.getDriverClass());
            }
            return DriverManager.getConnection(entry.getUrl(), entry.getUser(),
                    entry.getPassword());
        }, new TemporalTableSynchronizer());
    }

    SyncJobRunner(ConnectionConfig connectionConfig, SyncConfig syncConfig,
            TableJobConfig tableJobConfig, ConnectionProvider connectionProvider,
            TemporalTableSynchronizer synchronizer) {
        this.connectionConfig = connectionConfig;
        this.syncConfig = syncConfig;
        this.tableJobConfig = tableJobConfig;
        this.connectionProvider = connectionProvider;
        this.synchronizer = synchronizer;
    }

    /**
     * Synchronizes the targeted tables.
     *
     * @param asOf as-of date of every version written by this execution
     * @param tableIds job ids to run; all jobs when {@code null} or empty
     */
    public void execute(LocalDate asOf, List<String> tableIds) {
        log.info("=== SyncJobRunner started (asOf={}, tables={}) ===", asOf,
                tableIds == null || tableIds.isEmpty() ? "ALL" : tableIds);

        if (tableIds != null) {
            List<String> unknown = tableIds.stream()
                    .filter(id -> tableJobConfig.find(id).isEmpty()).collect(Collectors.toList());
            if (!unknown.isEmpty()) {
                ErrorHandler.errorAndExit("Unknown table job(s): " + unknown);
                return;
            }
        }

        for (TableJobConfig.Job job : tableJobConfig.getTables()) {
            if (tableIds != null && !tableIds.isEmpty() && !tableIds.contains(job.getId())) {
                log.info("[{}] Not targeted → skipping", job.getId());
                continue;
            }
            runJob(job, asOf);
        }

        log.info("=== SyncJobRunner finished ===");
        logSummary();
    }

    public Map<String, SyncSummary> getSummaries() {
        return summaries;
    }

    public List<String> getFailedJobs() {
        return failedJobs;
    }

    private void runJob(TableJobConfig.Job job, LocalDate asOf) {
        String jobId = job.getId();
        try {
            ConnectionConfig.Entry entry = connection(job.getConnectionId(), jobId);
            TableDefinition table = job.toTableDefinition();
            SyncOptions options = syncConfig.toOptions(job, asOf);

            try (Connection jdbc = connectionProvider.open(entry)) {
                jdbc.setAutoCommit(false);
                if (syncConfig.isSerializable()) {
                    jdbc.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
                }
                try {
                    JdbcVersionedTableSink sink = new JdbcVersionedTableSink(jdbc,
                            entry.resolveDialect(), table, options);
                    sink.ensureTable();
                    SyncSummary summary = synchronize(job, table, sink, options);
                    jdbc.commit();
                    summaries.put(jobId, summary);
                    log.info("[{}] Transaction committed (table={})", jobId, table.getName());
                } catch (Exception e) {
                    try {
                        jdbc.rollback();
                        log.warn("[{}] Transaction rolled back due to error.", jobId);
                    } catch (SQLException rollbackEx) {
                        log.warn("[{}] Rollback failed: {}", jobId, rollbackEx.getMessage(),
                                rollbackEx);
                        e.addSuppressed(rollbackEx);
                    }
                    throw e;
                }
            }
        } catch (Exception e) {
            failedJobs.add(jobId);
            log.error("[{}] Synchronization failed: {}", jobId, e.getMessage(), e);
            ErrorHandler.errorAndExit("Synchronization failed (table job=" + jobId + ")", e);
        }
    }

    private SyncSummary synchronize(TableJobConfig.Job job, TableDefinition table,
            JdbcVersionedTableSink sink, SyncOptions options) throws Exception {
        if (RowSourceFactory.resolveFormat(job.getSource()) != SourceFormat.TABLE) {
            RowSource source = RowSourceFactory.create(job, table, null, null);
            return synchronizer.synchronize(source, sink, options);
        }

        ConnectionConfig.Entry sourceEntry =
                connection(job.getSource().getConnectionId(), job.getId());
        SqlDialect sourceDialect = sourceEntry.resolveDialect();
        try (Connection sourceJdbc = connectionProvider.open(sourceEntry)) {
            // PostgreSQL honours the fetch size only outside auto-commit
            sourceJdbc.setAutoCommit(false);
            sourceJdbc.setReadOnly(true);
            RowSource source = RowSourceFactory.create(job, table, sourceJdbc, sourceDialect);
            SyncSummary summary = synchronizer.synchronize(source, sink, options);
            sourceJdbc.commit();
            return summary;
        }
    }

    private ConnectionConfig.Entry connection(String connectionId, String jobId) {
        return connectionConfig.find(connectionId).orElseThrow(() -> new IllegalArgumentException(
                "Job [" + jobId + "] refers to unknown connection [" + connectionId + "]"));
    }

    /**
     * Outputs a consolidated log of all jobs.
     */
    private void logSummary() {
        log.info("===== Summary =====");
        int maxNameLen = summaries.keySet().stream().mapToInt(String::length).max().orElse(0);
        for (String failed : failedJobs) {
            maxNameLen = Math.max(maxNameLen, failed.length());
        }
        String fmt = "  Table[%-" + maxNameLen + "s] new=%d modified=%d unchanged=%d deleted=%d"
                + " skipped=%d closed=%d (%d ms)";
        summaries.forEach((jobId, s) -> log.info(String.format(fmt, jobId, s.getNewRows(),
                s.getModifiedRows(), s.getUnchangedRows(), s.getDeletedRows(),
                s.getDuplicatesSkipped(), s.getClosedIds().size(), s.getElapsedMillis())));
        String failedFmt = "  Table[%-" + maxNameLen + "s] FAILED";
        failedJobs.forEach(jobId -> log.info(String.format(failedFmt, jobId)));
        log.info("== Synchronization of all tables has completed ==");
    }
}
