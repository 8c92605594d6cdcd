package io.github.yok.temporalsync.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of the current-state extract: an ordered mapping from column name to a scalar value.
 *
 * <p>
 * Values are expected to be strings, integers, floats, dates, byte arrays or {@code null}. The
 * mapping is copied on construction and exposed read-only.
 * </p>
 */
public final class SourceRow {

    private final Map<String, Object> values;

    /**
     * Creates a row from an ordered column/value mapping.
     *
     * @param values column values in presentation order
     */
    public SourceRow(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a column.
     *
     * @param column column name
     * @return value, or {@code null} if the column is absent or null
     */
    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns whether the row declares the column (its value may still be {@code null}).
     *
     * @param column column name
     * @return {@code true} if declared
     */
    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceRow)) {
            return false;
        }
        return values.equals(((SourceRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SourceRow" + values;
    }
}
