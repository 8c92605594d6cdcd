package io.github.yok.temporalsync.source;

import io.github.yok.temporalsync.core.SourceReadException;
import io.github.yok.temporalsync.sink.ColumnDefinition;
import io.github.yok.temporalsync.sink.SqlDialect;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the current state from a table of another JDBC connection.
 *
 * <p>
 * All columns of the table are selected through a forward-only cursor with a fixed fetch size; the
 * result set labels go through {@link SourceRowNormalizer#resolveHeader(List)} once, and each
 * value is read with the type of the target column it maps to. The connection is owned by the
 * caller.
 * </p>
 */
@Slf4j
@Getter
@Builder
public class JdbcTableRowSource implements RowSource {

    /** Fetch size used when the job does not set one. */
    public static final int DEFAULT_FETCH_SIZE = 1000;

    @NonNull
    private final Connection connection;

    @NonNull
    private final SqlDialect dialect;

    // Source table, optionally schema-qualified ("schema.table")
    @NonNull
    private final String table;

    @NonNull
    private final SourceRowNormalizer normalizer;

    @Builder.Default
    private final int fetchSize = DEFAULT_FETCH_SIZE;

    @Override
    public Stream<SourceRow> rows() {
        String sql = "SELECT * FROM " + qualifiedName();
        PreparedStatement ps = null;
        try {
            ps = connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY,
                    ResultSet.CONCUR_READ_ONLY);
            ps.setFetchSize(fetchSize);
            ResultSet rs = ps.executeQuery();
            List<ColumnDefinition> columns = resolveColumns(rs.getMetaData());
            log.debug("Reading source table [{}] with fetch size {}", table, fetchSize);

            PreparedStatement statement = ps;
            return StreamSupport.stream(new RowSpliterator(rs, columns), false).onClose(() -> {
                try {
                    rs.close();
                    statement.close();
                } catch (SQLException e) {
                    throw new SourceReadException("Failed to close source table [" + table + "]",
                            e);
                }
            });
        } catch (SQLException e) {
            SourceReadException failure =
                    new SourceReadException("Failed to query source table [" + table + "]", e);
            closeAfterFailure(ps, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfterFailure(ps, e);
            throw e;
        }
    }

    String qualifiedName() {
        List<String> parts = new ArrayList<>();
        for (String part : table.split("\\.")) {
            parts.add(dialect.quoteIdentifier(part));
        }
        return String.join(".", parts);
    }

    private List<ColumnDefinition> resolveColumns(ResultSetMetaData meta) throws SQLException {
        List<String> labels = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i));
        }
        return normalizer.resolveHeader(labels);
    }

    private static void closeAfterFailure(PreparedStatement ps, RuntimeException primary) {
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
     * Maps result set rows to source rows one at a time.
     */
    private final class RowSpliterator extends Spliterators.AbstractSpliterator<SourceRow> {

        private final ResultSet rs;
        private final List<ColumnDefinition> columns;

        RowSpliterator(ResultSet rs, List<ColumnDefinition> columns) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rs = rs;
            this.columns = columns;
        }

        @Override
        public boolean tryAdvance(Consumer<? super SourceRow> action) {
            try {
                if (!rs.next()) {
                    return false;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    ColumnDefinition column = columns.get(i);
                    if (column != null) {
                        values.put(column.getName(),
                                SourceRowNormalizer.clean(column.getType().read(rs, i + 1)));
                    }
                }
                action.accept(new SourceRow(values));
                return true;
            } catch (SQLException e) {
                throw new SourceReadException("Failed to read source table [" + table + "]", e);
            }
        }
    }
}
