package io.github.yok.temporalsync.sink;

import io.github.yok.temporalsync.core.SinkException;
import io.github.yok.temporalsync.core.SyncOptions;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VersionedTableSink} backed by a relational table reached through JDBC.
 *
 * <p>
 * The connection is owned by the caller, who also decides when to commit, roll back and close it.
 * All statements quote identifiers through the {@link SqlDialect}, so table and column names keep
 * the case given in the {@link TableDefinition}.
 * </p>
 *
 * <p>
 * Table layout: {@code id} (identity primary key), the business columns in declared order, then
 * {@code valid_from} and {@code valid_to} as {@code DATE}. The system column names come from
 * {@link SystemColumns}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcVersionedTableSink implements VersionedTableSink {

    private final Connection connection;

    @Getter
    private final SqlDialect dialect;

    @Getter
    private final TableDefinition table;

    private final SystemColumns systemColumns;

    // valid_to value that marks a current version
    private final LocalDate sentinelValidTo;

    // Fetch size of the scan and statements per executeBatch of a close
    private final int batchSize;

    /**
     * Creates a sink for one table.
     *
     * @param connection caller-managed connection
     * @param dialect SQL dialect of the connection
     * @param table table layout
     * @param options run options supplying system column names, sentinel date and chunk size
     */
    public JdbcVersionedTableSink(Connection connection, SqlDialect dialect, TableDefinition table,
            SyncOptions options) {
        this.connection = connection;
        this.dialect = dialect;
        this.table = table;
        this.systemColumns = options.getSystemColumns();
        this.sentinelValidTo = options.getSentinelValidTo();
        this.batchSize = options.getChunkSize();
    }

    /**
     * Creates the table and its indexes when it does not exist yet.
     *
     * @return {@code true} if the table was created
     * @throws SinkException on DDL or metadata failure
     */
    public boolean ensureTable() {
        try {
            if (tableExists()) {
                log.debug("Table [{}] already exists", table.getName());
                return false;
            }
            try (Statement st = connection.createStatement()) {
                st.execute(createTableSql());
                st.execute(createIndexSql(table.getNaturalKey()));
                st.execute(createIndexSql(List.of(systemColumns.getValidToColumn())));
            }
            log.info("Created versioned table [{}]", table.getName());
            return true;
        } catch (SQLException e) {
            throw new SinkException("Failed to create table [" + table.getName() + "]", e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>
     * Reads with a fetch size equal to the chunk size. Closing the stream closes the underlying
     * statement and result set.
     * </p>
     */
    @Override
    public Stream<VersionedRecord> scanCurrent() {
        String sql = selectCurrentSql();
        PreparedStatement ps = null;
        try {
            ps = connection.prepareStatement(sql);
            ps.setFetchSize(batchSize);
            ps.setObject(1, sentinelValidTo);
            ResultSet rs = ps.executeQuery();
            PreparedStatement statement = ps;
            return StreamSupport.stream(new RecordSpliterator(rs), false).onClose(() -> {
                try {
                    rs.close();
                    statement.close();
                } catch (SQLException e) {
                    throw new SinkException("Failed to close scan of [" + table.getName() + "]",
                            e);
                }
            });
        } catch (SQLException e) {
            closeAfterFailure(ps, e);
            throw new SinkException("Failed to scan current versions of [" + table.getName() + "]",
                    e);
        }
    }

    @Override
    public void insertBatch(List<VersionedRecord> rows) {
        if (rows.isEmpty()) {
            return;
        }
        List<ColumnDefinition> columns = table.getColumns();
        try (PreparedStatement ps = connection.prepareStatement(insertSql())) {
            for (VersionedRecord row : rows) {
                Map<String, Object> values = lookupIgnoringCase(row.getValues());
                int index = 1;
                for (ColumnDefinition column : columns) {
                    column.getType().bind(ps, index++,
                            values.get(column.getName().toLowerCase(Locale.ROOT)));
                }
                ps.setObject(index++, row.getValidFrom());
                ps.setObject(index, row.getValidTo());
                ps.addBatch();
            }
            ps.executeBatch();
            log.debug("Inserted {} row(s) into [{}]", rows.size(), table.getName());
        } catch (SQLException e) {
            throw new SinkException("Failed to insert " + rows.size() + " row(s) into ["
                    + table.getName() + "]", e);
        }
    }

    @Override
    public void closeBatch(Collection<Long> ids, LocalDate asOf) {
        if (ids.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = connection.prepareStatement(closeSql())) {
            List<Long> pending = new ArrayList<>(Math.min(ids.size(), batchSize));
            for (Long id : ids) {
                ps.setObject(1, asOf);
                ps.setLong(2, id);
                ps.addBatch();
                pending.add(id);
                if (pending.size() == batchSize) {
                    checkClosed(pending, ps.executeBatch());
                    pending.clear();
                }
            }
            if (!pending.isEmpty()) {
                checkClosed(pending, ps.executeBatch());
            }
            log.debug("Closed {} version(s) in [{}] as of {}", ids.size(), table.getName(), asOf);
        } catch (SQLException e) {
            throw new SinkException("Failed to close " + ids.size() + " version(s) in ["
                    + table.getName() + "]", e);
        }
    }

    // Each id must match exactly one row; SUCCESS_NO_INFO is accepted as is
    private void checkClosed(List<Long> ids, int[] counts) {
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] != 1 && counts[i] != Statement.SUCCESS_NO_INFO) {
                throw new SinkException("Closing version id=" + ids.get(i) + " in ["
                        + table.getName() + "] updated " + counts[i] + " row(s)");
            }
        }
    }

        String createTableSql() {
        StringBuilder sql = new StringBuilder("CREATE TABLE ")
                .append(q(table.getName())).append(" (")
                .append(q(systemColumns.getIdColumn())).append(' ')
                .append(dialect.identityColumnType());
        for (ColumnDefinition column : table.getColumns()) {
            sql.append(", ").append(q(column.getName())).append(' ')
                    .append(dialect.sqlType(column));
        }
        sql.append(", ").append(q(systemColumns.getValidFromColumn())).append(" DATE NOT NULL")
                .append(", ").append(q(systemColumns.getValidToColumn())).append(" DATE NOT NULL")
                .append(')');
        return sql.toString();
    }

    String createIndexSql(List<String> columns) {
        String indexName = "ix_" + table.getName() + "_" + String.join("_", columns);
        return "CREATE INDEX " + q(indexName) + " ON " + q(table.getName()) + " ("
                + columns.stream().map(this::q).collect(Collectors.joining(", ")) + ")";
    }

    String selectCurrentSql() {
        List<String> names = new ArrayList<>();
        names.add(q(systemColumns.getIdColumn()));
        for (String column : table.columnNames()) {
            names.add(q(column));
        }
        names.add(q(systemColumns.getValidFromColumn()));
        names.add(q(systemColumns.getValidToColumn()));
        return "SELECT " + String.join(", ", names) + " FROM " + q(table.getName()) + " WHERE "
                + q(systemColumns.getValidToColumn()) + " = ?";
    }

    String insertSql() {
        List<String> names = new ArrayList<>();
        for (String column : table.columnNames()) {
            names.add(q(column));
        }
        names.add(q(systemColumns.getValidFromColumn()));
        names.add(q(systemColumns.getValidToColumn()));
        String placeholders = names.stream().map(n -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + q(table.getName()) + " (" + String.join(", ", names)
                + ") VALUES (" + placeholders + ")";
    }

    String closeSql() {
        return "UPDATE " + q(table.getName()) + " SET " + q(systemColumns.getValidToColumn())
                + " = ? WHERE " + q(systemColumns.getIdColumn()) + " = ?";
    }

    private boolean tableExists() throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String name = table.getName();
        Set<String> candidates = new LinkedHashSet<>(List.of(name,
                name.toUpperCase(Locale.ROOT), name.toLowerCase(Locale.ROOT)));
        for (String candidate : candidates) {
            try (ResultSet rs = meta.getTables(null, null, candidate, null)) {
                while (rs.next()) {
                    if (candidate.equals(rs.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private String q(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    private static Map<String, Object> lookupIgnoringCase(Map<String, Object> values) {
        Map<String, Object> lookup = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            lookup.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        return lookup;
    }

    private static void closeAfterFailure(PreparedStatement ps, SQLException primary) {
        if (ps == null) {
            return;
        }
        try {
            ps.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * Maps the rows of the current-slice query to records one at a time.
     */
    private final class RecordSpliterator
            extends Spliterators.AbstractSpliterator<VersionedRecord> {

        private final ResultSet rs;

        RecordSpliterator(ResultSet rs) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rs = rs;
        }

        @Override
        public boolean tryAdvance(Consumer<? super VersionedRecord> action) {
            try {
                if (!rs.next()) {
                    return false;
                }
                long id = rs.getLong(1);
                Map<String, Object> values = new LinkedHashMap<>();
                int index = 2;
                for (ColumnDefinition column : table.getColumns()) {
                    values.put(column.getName(), column.getType().read(rs, index++));
                }
                LocalDate validFrom = rs.getObject(index++, LocalDate.class);
                LocalDate validTo = rs.getObject(index, LocalDate.class);
                action.accept(new VersionedRecord(id, values, validFrom, validTo));
                return true;
            } catch (SQLException e) {
                throw new SinkException("Failed to read current versions of [" + table.getName()
                        + "]", e);
            }
        }
    }
}
