package io.github.yok.temporalsync.sink;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Names of the three columns every versioned table adds to the caller's business columns.
 *
 * <ul>
 * <li>{@code id}: surrogate key assigned on insert</li>
 * <li>{@code valid_from}: as-of date of the run that created the version</li>
 * <li>{@code valid_to}: as-of date of the run that closed the version, or the sentinel date while
 * the version is current</li>
 * </ul>
 */
@Getter
public final class SystemColumns {

    /** Default names: {@code id}, {@code valid_from}, {@code valid_to}. */
    public static final SystemColumns DEFAULT = new SystemColumns("id", "valid_from", "valid_to");

    private final String idColumn;
    private final String validFromColumn;
    private final String validToColumn;

    /**
     * Creates a set of system column names.
     *
     * @param idColumn surrogate key column
     * @param validFromColumn version start column
     * @param validToColumn version end column
     */
    public SystemColumns(String idColumn, String validFromColumn, String validToColumn) {
        Preconditions.checkArgument(StringUtils.isNotBlank(idColumn), "idColumn is blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(validFromColumn),
                "validFromColumn is blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(validToColumn),
                "validToColumn is blank");
        this.idColumn = idColumn;
        this.validFromColumn = validFromColumn;
        this.validToColumn = validToColumn;
    }

    /**
     * Returns the three names in table order.
     *
     * @return id, valid-from and valid-to column names
     */
    public List<String> names() {
        return ImmutableList.of(idColumn, validFromColumn, validToColumn);
    }

    /**
     * Returns whether the given column is one of the system columns (case-insensitive).
     *
     * @param column column name
     * @return {@code true} for a system column
     */
    public boolean contains(String column) {
        if (column == null) {
            return false;
        }
        String lower = column.toLowerCase(Locale.ROOT);
        return idColumn.toLowerCase(Locale.ROOT).equals(lower)
                || validFromColumn.toLowerCase(Locale.ROOT).equals(lower)
                || validToColumn.toLowerCase(Locale.ROOT).equals(lower);
    }

    @Override
    public String toString() {
        return names().toString();
    }
}
