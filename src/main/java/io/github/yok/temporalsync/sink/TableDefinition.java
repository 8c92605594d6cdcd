package io.github.yok.temporalsync.sink;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Layout of a versioned table: its name, business columns in declared order and natural key.
 *
 * <p>
 * The system columns are not part of the definition; they are added by the sink.
 * </p>
 */
@Getter
@ToString
public final class TableDefinition {

    private final String name;
    private final List<ColumnDefinition> columns;
    private final List<String> naturalKey;

    /**
     * Creates a table definition.
     *
     * @param name table name
     * @param columns business columns in declared order
     * @param naturalKey natural-key column names, each one of {@code columns} ignoring case; they
     *        are kept with the spelling of the column declaration
     * @throws IllegalArgumentException if the definition is inconsistent
     */
    public TableDefinition(String name, List<ColumnDefinition> columns, List<String> naturalKey) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "table name is blank");
        Preconditions.checkArgument(columns != null && !columns.isEmpty(),
                "table [%s] declares no columns", name);
        Preconditions.checkArgument(naturalKey != null && !naturalKey.isEmpty(),
                "table [%s] declares no natural key", name);

        // lower-cased name to declared name
        Map<String, String> declared = new HashMap<>();
        for (ColumnDefinition column : columns) {
            Preconditions.checkArgument(
                    declared.put(column.getName().toLowerCase(Locale.ROOT),
                            column.getName()) == null,
                    "table [%s] declares column [%s] twice", name, column.getName());
        }
        // rows are keyed by the declared spelling
        ImmutableList.Builder<String> keyColumns = ImmutableList.builder();
        for (String key : naturalKey) {
            String column = key == null ? null : declared.get(key.toLowerCase(Locale.ROOT));
            Preconditions.checkArgument(column != null,
                    "natural-key column [%s] is not a column of table [%s]", key, name);
            keyColumns.add(column);
        }
        this.name = name;
        this.columns = ImmutableList.copyOf(columns);
        this.naturalKey = keyColumns.build();
    }

    /**
     * Returns the business column names in declared order.
     *
     * @return column names
     */
    public List<String> columnNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (ColumnDefinition column : columns) {
            names.add(column.getName());
        }
        return names.build();
    }

    /**
     * Looks a column up by name, ignoring case.
     *
     * @param columnName column name
     * @return the column, if declared
     */
    public Optional<ColumnDefinition> column(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        for (ColumnDefinition column : columns) {
            if (column.getName().equalsIgnoreCase(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
