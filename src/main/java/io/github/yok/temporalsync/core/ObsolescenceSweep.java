package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.sink.VersionedTableSink;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Closes superseded and vanished versions once the whole source has been observed.
 *
 * <p>
 * The ids to close are the ids of modified rows plus, when {@code closeDeletedRows} is enabled, the
 * ids of every cached key the source did not mention. They are handed to
 * {@link VersionedTableSink#closeBatch(Collection, java.time.LocalDate)} once, in ascending order.
 * Running the sweep before the source is drained would close rows that simply had not been read
 * yet.
 * </p>
 */
@Slf4j
public class ObsolescenceSweep {

    private final VersionedTableSink sink;

    public ObsolescenceSweep(VersionedTableSink sink) {
        this.sink = sink;
    }

    /**
     * Sweeps the run and records the closed ids in its state.
     *
     * @param state drained run state
     * @return ids closed, ascending; empty when nothing was issued
     * @throws SinkException if the close fails
     */
    public List<Long> sweep(RunState state) {
        SyncOptions options = state.getOptions();
        List<Long> deleted = unseenIds(state.getCache(), state.getSeenKeys());
        if (!options.isCloseDeletedRows()) {
            if (!deleted.isEmpty()) {
                log.debug("{} current version(s) absent from the source left open", deleted.size());
            }
            deleted = List.of();
        }

        TreeSet<Long> closeIds = new TreeSet<>(state.getModifiedIds());
        closeIds.addAll(deleted);
        List<Long> closed = issue(closeIds, options);
        state.recordSweep(closed, deleted.size());
        return closed;
    }

    /**
     * Computes the ids to close without touching run state.
     *
     * @param cache version cache of the run
     * @param seenKeys keys observed in the source
     * @param modifiedIds cached ids superseded by modified rows
     * @param closeDeletedRows whether unseen keys are closed
     * @return ids to close, ascending
     */
    public static List<Long> closeIds(VersionCache cache, Set<NaturalKey> seenKeys,
            Collection<Long> modifiedIds, boolean closeDeletedRows) {
        TreeSet<Long> ids = new TreeSet<>(modifiedIds);
        if (closeDeletedRows) {
            ids.addAll(unseenIds(cache, seenKeys));
        }
        return new ArrayList<>(ids);
    }

    private List<Long> issue(TreeSet<Long> closeIds, SyncOptions options) {
        if (closeIds.isEmpty()) {
            log.debug("Nothing to close");
            return List.of();
        }
        List<Long> ids = new ArrayList<>(closeIds);
        sink.closeBatch(ids, options.getAsOf());
        log.debug("Closed {} version(s) as of {}", ids.size(), options.getAsOf());
        return ids;
    }

    private static List<Long> unseenIds(VersionCache cache, Set<NaturalKey> seenKeys) {
        List<Long> ids = new ArrayList<>();
        for (Map.Entry<NaturalKey, CachedVersion> entry : cache.asMap().entrySet()) {
            if (!seenKeys.contains(entry.getKey())) {
                ids.add(entry.getValue().getId());
            }
        }
        return ids;
    }
}
