package io.github.yok.temporalsync.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;

/**
 * Closed set of value kinds a row may carry, each with one canonical encoding.
 *
 * <p>
 * The canonical form removes differences that come from the extraction path rather than from the
 * data: {@code 1} and {@code "1"} encode identically, surrounding whitespace is dropped, a blank
 * string is treated as {@code null}, and {@code 1.50} equals {@code 1.5}.
 * </p>
 *
 * <ul>
 * <li>{@link #NULL}: {@code null} and blank strings</li>
 * <li>{@link #STRING}: {@link CharSequence}</li>
 * <li>{@link #INTEGER}: {@code Byte}, {@code Short}, {@code Integer}, {@code Long},
 * {@link BigInteger}</li>
 * <li>{@link #FLOAT}: {@code Float}, {@code Double}, {@link BigDecimal}</li>
 * <li>{@link #DATE}: {@link LocalDate}, {@link LocalDateTime}, {@link java.sql.Date},
 * {@link Timestamp}</li>
 * <li>{@link #BINARY}: {@code byte[]}, hashed as-is</li>
 * </ul>
 */
public enum CanonicalValueType {

    NULL {
        @Override
        byte[] encode(Object value) {
            return null;
        }
    },

    STRING {
        @Override
        byte[] encode(Object value) {
            return StringUtils.strip(value.toString()).getBytes(StandardCharsets.UTF_8);
        }
    },

    INTEGER {
        @Override
        byte[] encode(Object value) {
            String text = value instanceof BigInteger ? value.toString()
                    : Long.toString(((Number) value).longValue());
            return text.getBytes(StandardCharsets.UTF_8);
        }
    },

    FLOAT {
        @Override
        byte[] encode(Object value) {
            if (value instanceof Double && !Double.isFinite((Double) value)
                    || value instanceof Float && !Float.isFinite((Float) value)) {
                return value.toString().getBytes(StandardCharsets.UTF_8);
            }
            BigDecimal decimal = value instanceof BigDecimal ? (BigDecimal) value
                    : new BigDecimal(value.toString());
            String text =
                    decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
            return text.getBytes(StandardCharsets.UTF_8);
        }
    },

    DATE {
        @Override
        byte[] encode(Object value) {
            String text;
            if (value instanceof java.sql.Date) {
                text = ((java.sql.Date) value).toLocalDate()
                        .format(DateTimeFormatter.ISO_LOCAL_DATE);
            } else if (value instanceof Timestamp) {
                text = ((Timestamp) value).toLocalDateTime()
                        .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } else if (value instanceof LocalDateTime) {
                text = ((LocalDateTime) value).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } else {
                text = ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
            }
            return text.getBytes(StandardCharsets.UTF_8);
        }
    },

    BINARY {
        @Override
        byte[] encode(Object value) {
            return (byte[]) value;
        }
    };

    /**
     * Encodes a value of this kind.
     *
     * @param value value already classified as this kind
     * @return canonical bytes, or {@code null} for {@link #NULL}
     */
    abstract byte[] encode(Object value);

    /**
     * Classifies a value.
     *
     * @param value raw value from a source row or a stored record
     * @return the value kind
     * @throws IllegalArgumentException if the Java type is outside the supported set
     */
    public static CanonicalValueType of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof CharSequence) {
            return StringUtils.isBlank((CharSequence) value) ? NULL : STRING;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof LocalDate || value instanceof LocalDateTime
                || value instanceof java.sql.Date || value instanceof Timestamp) {
            return DATE;
        }
        if (value instanceof byte[]) {
            return BINARY;
        }
        throw new IllegalArgumentException(
                "Unsupported column value type: " + value.getClass().getName());
    }

    /**
     * Returns the canonical bytes of any supported value.
     *
     * @param value raw value
     * @return canonical bytes, or {@code null} when the value canonicalizes to null
     */
    public static byte[] canonicalBytes(Object value) {
        return of(value).encode(value);
    }

    /**
     * Returns the canonical text of any supported value. Binary values are rendered as hex.
     *
     * @param value raw value
     * @return canonical text, or {@code null} when the value canonicalizes to null
     */
    public static String canonicalText(Object value) {
        CanonicalValueType type = of(value);
        byte[] bytes = type.encode(value);
        if (bytes == null) {
            return null;
        }
        if (type == BINARY) {
            return Hex.encodeHexString(bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
