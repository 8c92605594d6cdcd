package io.github.yok.temporalsync.sink;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Logical type of a business column of a versioned table.
 *
 * <p>
 * Each type knows how to convert text read from a flat file, how to bind a value to a
 * {@link PreparedStatement} and how to read it back from a {@link ResultSet}, so that a value
 * loaded from a file and the same value read from the target hash identically.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ColumnType {

    // Unbounded text
    TEXT(Types.VARCHAR) {
        @Override
        Object parseText(String text, DateTimeFormatter datePattern) {
            return text;
        }

        @Override
        public Object read(ResultSet rs, int index) throws SQLException {
            return rs.getString(index);
        }
    },

    // Text with a declared maximum length
    VARCHAR(Types.VARCHAR) {
        @Override
        Object parseText(String text, DateTimeFormatter datePattern) {
            return text;
        }

        @Override
        public Object read(ResultSet rs, int index) throws SQLException {
            return rs.getString(index);
        }
    },

    // 64-bit integer
    INTEGER(Types.BIGINT) {
        @Override
        Object parseText(String text, DateTimeFormatter datePattern) {
            // "12.0" as exported by spreadsheets
            return new BigDecimal(text).longValueExact();
        }

        @Override
        public Object read(ResultSet rs, int index) throws SQLException {
            long value = rs.getLong(index);
            return rs.wasNull() ? null : value;
        }
    },

    // Double precision floating point
    FLOAT(Types.DOUBLE) {
        @Override
        Object parseText(String text, DateTimeFormatter datePattern) {
            return Double.valueOf(text);
        }

        @Override
        public Object read(ResultSet rs, int index) throws SQLException {
            double value = rs.getDouble(index);
            return rs.wasNull() ? null : value;
        }
    },

    // Calendar date without time
    DATE(Types.DATE) {
        @Override
        Object parseText(String text, DateTimeFormatter datePattern) {
            return datePattern == null ? LocalDate.parse(text) : LocalDate.parse(text, datePattern);
        }

        @Override
        public Object read(ResultSet rs, int index) throws SQLException {
            return rs.getObject(index, LocalDate.class);
        }
    };

    // java.sql.Types code used for NULL binding
    private final int jdbcType;

    ColumnType(int jdbcType) {
        this.jdbcType = jdbcType;
    }

    abstract Object parseText(String text, DateTimeFormatter datePattern);

    /**
     * Reads a column of this type from the current row of a result set.
     *
     * @param rs result set positioned on a row
     * @param index one-based column index
     * @return value, or {@code null} for SQL NULL
     * @throws SQLException on read failure
     */
    public abstract Object read(ResultSet rs, int index) throws SQLException;

    /**
     * Converts text from a flat file to this type.
     *
     * @param text raw field text
     * @param datePattern pattern for {@link #DATE}, or {@code null} for ISO-8601
     * @return converted value, or {@code null} for blank text
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    public Object fromText(String text, DateTimeFormatter datePattern) {
        String stripped = StringUtils.strip(text);
        if (StringUtils.isEmpty(stripped)) {
            return null;
        }
        try {
            return parseText(stripped, datePattern);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    "Value [" + stripped + "] is not a valid " + name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts a value of any supported Java type to the representation of this type.
     *
     * @param value value from a source row or a stored record
     * @return {@code String}, {@code Long}, {@code Double} or {@code LocalDate}; {@code null} for
     *         a null value or blank non-text value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case INTEGER:
                return value instanceof Number ? (Object) ((Number) value).longValue()
                        : fromText(value.toString(), null);
            case FLOAT:
                return value instanceof Number ? (Object) ((Number) value).doubleValue()
                        : fromText(value.toString(), null);
            case DATE:
                return toLocalDate(value);
            default:
                return value.toString();
        }
    }

    /**
     * Binds a value to a statement parameter, converting it to this type where needed.
     *
     * @param ps statement
     * @param index one-based parameter index
     * @param value value to bind, may be {@code null}
     * @throws SQLException on bind failure
     */
    public void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        Object coerced = coerce(value);
        if (coerced == null) {
            ps.setNull(index, jdbcType);
        } else if (coerced instanceof Long) {
            ps.setLong(index, (Long) coerced);
        } else if (coerced instanceof Double) {
            ps.setDouble(index, (Double) coerced);
        } else if (coerced instanceof LocalDate) {
            ps.setObject(index, coerced);
        } else {
            ps.setString(index, (String) coerced);
        }
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        return (LocalDate) DATE.fromText(value.toString(), null);
    }
}
