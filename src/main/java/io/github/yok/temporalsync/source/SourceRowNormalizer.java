package io.github.yok.temporalsync.source;

import io.github.yok.temporalsync.core.SourceReadException;
import io.github.yok.temporalsync.sink.ColumnDefinition;
import io.github.yok.temporalsync.sink.TableDefinition;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps extracted columns onto the columns of a versioned table and cleans their values.
 *
 * <p>
 * Header names are trimmed, repeated names get a numeric suffix ({@code A}, {@code A_2},
 * {@code A_3}), then the column map renames them. A resulting name that is not a column of the
 * table (compared ignoring case) is dropped. Text values are stripped and blanks become
 * {@code null}.
 * </p>
 *
 * <p>
 * Unless partial extracts are allowed, every column of the table must be provided by the header.
 * A renamed upstream column would otherwise load as {@code null} and version every row.
 * </p>
 */
@Slf4j
public class SourceRowNormalizer {

    private final TableDefinition table;

    // Extracted name (after trimming and de-duplication) to target name
    private final Map<String, String> columnMap;

    // Pattern of DATE fields in text sources; null means ISO-8601
    private final DateTimeFormatter datePattern;

    private final boolean requireAllColumns;

    /**
     * Creates a normalizer.
     *
     * @param table target table
     * @param columnMap renaming of extracted columns, may be empty
     * @param datePattern pattern of date fields in text sources, or {@code null} for ISO-8601
     * @param requireAllColumns whether every table column must be provided by the header;
     *        natural-key columns are always required
     */
    public SourceRowNormalizer(TableDefinition table, Map<String, String> columnMap,
            DateTimeFormatter datePattern, boolean requireAllColumns) {
        this.table = table;
        this.columnMap = columnMap == null ? Collections.emptyMap() : new HashMap<>(columnMap);
        this.datePattern = datePattern;
        this.requireAllColumns = requireAllColumns;
    }

    public SourceRowNormalizer(TableDefinition table, Map<String, String> columnMap,
            DateTimeFormatter datePattern) {
        this(table, columnMap, datePattern, true);
    }

    public SourceRowNormalizer(TableDefinition table) {
        this(table, Collections.emptyMap(), null);
    }

    public TableDefinition getTable() {
        return table;
    }

    /**
     * Appends a suffix to repeated values.
     *
     * @param names names in order
     * @return names where the n-th occurrence of a repeated name is suffixed {@code _n}
     */
    public static List<String> uniquify(List<String> names) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> unique = new ArrayList<>(names.size());
        for (String name : names) {
            int count = seen.merge(name, 1, Integer::sum);
            if (count > 1) {
                String renamed = name + "_" + count;
                log.debug("Column [{}] renamed to [{}]", name, renamed);
                unique.add(renamed);
            } else {
                unique.add(name);
            }
        }
        return unique;
    }

    /**
     * Resolves the extracted header to target columns.
     *
     * @param rawNames header names as extracted, in order
     * @return target column per position; {@code null} where the column is dropped
     * @throws SourceReadException if a natural-key column of the table is not provided, or any
     *         other column when all columns are required
     */
    public List<ColumnDefinition> resolveHeader(List<String> rawNames) {
        List<String> trimmed = new ArrayList<>(rawNames.size());
        for (String name : rawNames) {
            trimmed.add(StringUtils.trimToEmpty(name));
        }

        List<ColumnDefinition> resolved = new ArrayList<>(trimmed.size());
        for (String name : uniquify(trimmed)) {
            String mapped = columnMap.getOrDefault(name, name);
            Optional<ColumnDefinition> column = table.column(mapped);
            if (column.isPresent()) {
                resolved.add(column.get());
            } else {
                log.debug("Column [{}] is not part of table [{}] and is dropped", name,
                        table.getName());
                resolved.add(null);
            }
        }

        for (String key : table.getNaturalKey()) {
            if (!provides(resolved, key)) {
                throw new SourceReadException("Source of table [" + table.getName()
                        + "] does not provide natural-key column [" + key + "]; header was "
                        + rawNames);
            }
        }
        if (requireAllColumns) {
            List<String> missing = new ArrayList<>();
            for (String column : table.columnNames()) {
                if (!provides(resolved, column)) {
                    missing.add(column);
                }
            }
            if (!missing.isEmpty()) {
                throw new SourceReadException("Source of table [" + table.getName()
                        + "] does not provide column(s) " + missing + "; header was " + rawNames);
            }
        }
        return resolved;
    }

    private static boolean provides(List<ColumnDefinition> resolved, String column) {
        return resolved.stream().anyMatch(c -> c != null && c.getName().equalsIgnoreCase(column));
    }

    /**
     * Converts one text field to the type of its column.
     *
     * @param column target column
     * @param text raw field text, may be {@code null}
     * @return converted value, {@code null} for blank text
     * @throws IllegalArgumentException if the text is not a valid value of the column type
     */
    public Object convert(ColumnDefinition column, String text) {
        return column.getType().fromText(text, datePattern);
    }

    /**
     * Cleans a value that is already typed, such as a value read from another table.
     *
     * @param value extracted value
     * @return stripped text, {@code null} for blank text, other values unchanged
     */
    public static Object clean(Object value) {
        if (value instanceof CharSequence) {
            return StringUtils.stripToNull(value.toString());
        }
        return value;
    }
}
