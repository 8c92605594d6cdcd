package io.github.yok.temporalsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered tuple of natural-key values that identifies one logical entity across its versions.
 *
 * <p>
 * Equality is based on the canonical text of each value (see {@link CanonicalValueType}), so a key
 * read from a file as {@code "42"} matches the same key stored in the target as {@code 42L}.
 * </p>
 */
public final class NaturalKey {

    private final List<String> canonicalValues;

    private NaturalKey(List<String> canonicalValues) {
        this.canonicalValues = Collections.unmodifiableList(canonicalValues);
    }

    /**
     * Extracts the natural key from a column/value mapping.
     *
     * @param values row values
     * @param keyColumns natural-key column names, in key order
     * @return natural key
     */
    public static NaturalKey of(Map<String, ?> values, List<String> keyColumns) {
        List<String> canonical = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            canonical.add(CanonicalValueType.canonicalText(values.get(column)));
        }
        return new NaturalKey(canonical);
    }

    /**
     * Builds a key directly from values, mainly for tests and diagnostics.
     *
     * @param values key values in key order
     * @return natural key
     */
    public static NaturalKey ofValues(Object... values) {
        List<String> canonical = new ArrayList<>(values.length);
        for (Object value : values) {
            canonical.add(CanonicalValueType.canonicalText(value));
        }
        return new NaturalKey(canonical);
    }

    public List<String> getCanonicalValues() {
        return canonicalValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NaturalKey)) {
            return false;
        }
        return canonicalValues.equals(((NaturalKey) o).canonicalValues);
    }

    @Override
    public int hashCode() {
        return canonicalValues.hashCode();
    }

    @Override
    public String toString() {
        return canonicalValues.stream().map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
