package io.github.yok.temporalsync.sink;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * One version of an entity as stored in (or about to be written to) a versioned table.
 *
 * <p>
 * {@code values} holds the business columns (natural key and payload) only. The system columns are
 * carried by the dedicated fields. A record that has not been inserted yet has a {@code null}
 * {@code id}.
 * </p>
 */
@Getter
public final class VersionedRecord {

    // Surrogate key; null until the sink assigns one
    private final Long id;

    // Business column values in column order
    private final Map<String, Object> values;

    // As-of date of the run that created this version
    private final LocalDate validFrom;

    // Sentinel date while current, otherwise the as-of date of the superseding run
    private final LocalDate validTo;

    /**
     * Creates a record.
     *
     * @param id surrogate key, or {@code null} for a pending insert
     * @param values business column values
     * @param validFrom start of validity
     * @param validTo end of validity
     */
    public VersionedRecord(Long id, Map<String, ?> values, LocalDate validFrom,
            LocalDate validTo) {
        this.id = id;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.validFrom = validFrom;
        this.validTo = validTo;
    }

    /**
     * Creates a new, not yet inserted version.
     *
     * @param values business column values
     * @param validFrom start of validity
     * @param validTo end of validity (normally the sentinel date)
     * @return pending record
     */
    public static VersionedRecord pending(Map<String, ?> values, LocalDate validFrom,
            LocalDate validTo) {
        return new VersionedRecord(null, values, validFrom, validTo);
    }

    @Override
    public String toString() {
        return "VersionedRecord[id=" + id + ", values=" + values + ", validFrom=" + validFrom
                + ", validTo=" + validTo + "]";
    }
}
