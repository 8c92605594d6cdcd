package io.github.yok.temporalsync.sink;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Business column of a versioned table: name, logical type and, for {@link ColumnType#VARCHAR},
 * maximum length.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ColumnDefinition {

    private final String name;
    private final ColumnType type;
    private final Integer length;

    /**
     * Creates a column definition.
     *
     * @param name column name as it appears in the target
     * @param type logical type
     * @param length maximum length for {@link ColumnType#VARCHAR}, ignored otherwise
     */
    public ColumnDefinition(String name, ColumnType type, Integer length) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "column name is blank");
        Preconditions.checkNotNull(type, "type of column [%s] is null", name);
        Preconditions.checkArgument(type != ColumnType.VARCHAR || length != null && length > 0,
                "VARCHAR column [%s] needs a positive length", name);
        this.name = name;
        this.type = type;
        this.length = length;
    }

    public static ColumnDefinition of(String name, ColumnType type) {
        return new ColumnDefinition(name, type, null);
    }

    public static ColumnDefinition varchar(String name, int length) {
        return new ColumnDefinition(name, ColumnType.VARCHAR, length);
    }
}
