package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.sink.VersionedTableSink;
import io.github.yok.temporalsync.source.RowSource;
import io.github.yok.temporalsync.source.SourceRow;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.time.StopWatch;

/**
 * Runs one synchronization of a source extract into a versioned table.
 *
 * <p>
 * The three phases run strictly in sequence, each only after the previous one completed:
 * </p>
 * <ol>
 * <li>the {@link VersionCache} is built from the current slice of the target,</li>
 * <li>the {@link Reconciler} drains the source and inserts new versions in chunks,</li>
 * <li>the {@link ObsolescenceSweep} closes superseded and vanished versions.</li>
 * </ol>
 *
 * <p>
 * Transaction control stays with the caller. A failure in any phase propagates unchanged and the
 * run state is dropped.
 * </p>
 */
@Slf4j
public class TemporalTableSynchronizer {

    private final RowHasher hasher;

    public TemporalTableSynchronizer() {
        this(new RowHasher());
    }

    public TemporalTableSynchronizer(RowHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Synchronizes the target with the source.
     *
     * @param source current-state extract
     * @param sink target table
     * @param options run options
     * @return counters of the run
     * @throws TemporalSyncException if any phase fails
     * @throws IllegalArgumentException if the options are inconsistent
     */
    public SyncSummary synchronize(RowSource source, VersionedTableSink sink,
            SyncOptions options) {
        options.validate();
        StopWatch watch = StopWatch.createStarted();
        log.info("Synchronization started: asOf={}, naturalKey={}, chunkSize={}",
                options.getAsOf(), options.getNaturalKey(), options.getChunkSize());

        VersionCache cache = VersionCache.build(sink, options, hasher);
        RunState state = new RunState(options, cache);

        try (Stream<SourceRow> rows = source.rows()) {
            new Reconciler(sink, hasher).reconcile(rows, state);
        }
        new ObsolescenceSweep(sink).sweep(state);

        watch.stop();
        SyncSummary summary = SyncSummary.of(state, watch.getTime());
        log.info("Synchronization finished: read={}, new={}, modified={}, unchanged={}, "
                + "deleted={}, skipped={}, closed={}, chunks={} ({} ms)",
                summary.getRowsRead(), summary.getNewRows(), summary.getModifiedRows(),
                summary.getUnchangedRows(), summary.getDeletedRows(),
                summary.getDuplicatesSkipped(), summary.getClosedIds().size(),
                summary.getChunksFlushed(), summary.getElapsedMillis());
        return summary;
    }
}
