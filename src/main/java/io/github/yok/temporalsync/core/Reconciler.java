package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.config.DuplicateKeyPolicy;
import io.github.yok.temporalsync.sink.SystemColumns;
import io.github.yok.temporalsync.sink.VersionedRecord;
import io.github.yok.temporalsync.sink.VersionedTableSink;
import io.github.yok.temporalsync.source.SourceRow;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies each source row against the version cache and writes new versions in chunks.
 *
 * <p>
 * Rows are handled strictly in input order. New and modified rows are queued as pending inserts
 * stamped {@code valid_from = asOf} and {@code valid_to = sentinel}; the queue is flushed through
 * {@link VersionedTableSink#insertBatch(List)} whenever it reaches the chunk size, and once more
 * after the last row. Ids of superseded versions are only collected here: closing them is left to
 * the {@link ObsolescenceSweep}.
 * </p>
 */
@Slf4j
public class Reconciler {

    private final VersionedTableSink sink;
    private final RowHasher hasher;

    public Reconciler(VersionedTableSink sink, RowHasher hasher) {
        this.sink = sink;
        this.hasher = hasher;
    }

    /**
     * Drains the source into the run state.
     *
     * @param rows source rows, consumed front to back
     * @param state state of the current run
     * @return the same state, populated
     * @throws MalformedSourceRowException if a row has no value for a natural-key column
     * @throws DuplicateNaturalKeyException if a key repeats under {@link DuplicateKeyPolicy#FAIL}
     * @throws SinkException if a chunk insert fails
     */
    public RunState reconcile(Stream<SourceRow> rows, RunState state) {
        Iterator<SourceRow> it = rows.iterator();
        while (it.hasNext()) {
            RowClassification classification = process(it.next(), state);
            state.count(classification);
        }
        flush(state);
        return state;
    }

    /**
     * Classifies one row and queues its effects.
     *
     * @param row source row
     * @param state state of the current run
     * @return classification of the row
     */
    RowClassification process(SourceRow row, RunState state) {
        SyncOptions options = state.getOptions();
        long rowNumber = state.nextRowNumber();

        for (String column : options.getNaturalKey()) {
            if (!row.hasColumn(column)
                    || CanonicalValueType.canonicalText(row.get(column)) == null) {
                throw new MalformedSourceRowException(rowNumber, column);
            }
        }
        NaturalKey key = NaturalKey.of(row.asMap(), options.getNaturalKey());

        if (!state.getSeenKeys().add(key)) {
            if (options.getDuplicateKeyPolicy() == DuplicateKeyPolicy.FAIL) {
                throw new DuplicateNaturalKeyException(rowNumber, key);
            }
            log.warn("Skipping repeated natural key {} at source row {}", key, rowNumber);
            return RowClassification.DUPLICATE_SKIPPED;
        }

        CachedVersion cached = state.getCache().get(key);
        if (cached == null) {
            enqueue(row, state);
            return RowClassification.NEW;
        }

        String digest = hasher.hash(row.asMap(), options.getNaturalKey(),
                options.getSystemColumns());
        if (digest.equals(cached.getDigest())) {
            return RowClassification.UNCHANGED;
        }
        state.getModifiedIds().add(cached.getId());
        enqueue(row, state);
        return RowClassification.MODIFIED;
    }

    private void enqueue(SourceRow row, RunState state) {
        SyncOptions options = state.getOptions();
        state.getPendingInserts().add(VersionedRecord.pending(
                businessValues(row, options.getSystemColumns()), options.getAsOf(),
                options.getSentinelValidTo()));
        if (state.getPendingInserts().size() >= options.getChunkSize()) {
            flush(state);
        }
    }

    private void flush(RunState state) {
        List<VersionedRecord> pending = state.getPendingInserts();
        if (pending.isEmpty()) {
            return;
        }
        List<VersionedRecord> chunk = new ArrayList<>(pending);
        sink.insertBatch(chunk);
        pending.clear();
        state.recordFlush(chunk.size());
        log.debug("Flushed chunk #{} ({} row(s))", state.getChunksFlushed(), chunk.size());
    }

    // System columns coming from the source are never copied into a new version
    private static Map<String, Object> businessValues(SourceRow row, SystemColumns systemColumns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.asMap().entrySet()) {
            if (!systemColumns.contains(entry.getKey())) {
                values.put(entry.getKey(), entry.getValue());
            }
        }
        return values;
    }
}
