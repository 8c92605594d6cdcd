package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.sink.VersionedRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * Mutable state of a single synchronization run.
 *
 * <p>
 * Created at run start with a freshly built {@link VersionCache}, filled by the {@link Reconciler},
 * consumed once by the {@link ObsolescenceSweep} and then discarded. Never shared between runs.
 * </p>
 */
@Getter
public final class RunState {

    private final SyncOptions options;

    private final VersionCache cache;

    // Natural keys observed in the source so far
    private final Set<NaturalKey> seenKeys = new HashSet<>();

    // Cached ids superseded by a modified row
    private final List<Long> modifiedIds = new ArrayList<>();

    // Versions waiting for the next insertBatch
    private final List<VersionedRecord> pendingInserts = new ArrayList<>();

    private long rowsRead;
    private long newRows;
    private long modifiedRows;
    private long unchangedRows;
    private long duplicatesSkipped;
    private long insertedRows;
    private int chunksFlushed;
    private long deletedRows;
    private List<Long> closedIds = new ArrayList<>();

    public RunState(SyncOptions options, VersionCache cache) {
        this.options = options;
        this.cache = cache;
    }

    long nextRowNumber() {
        return ++rowsRead;
    }

    void count(RowClassification classification) {
        switch (classification) {
            case NEW:
                newRows++;
                break;
            case MODIFIED:
                modifiedRows++;
                break;
            case UNCHANGED:
                unchangedRows++;
                break;
            case DUPLICATE_SKIPPED:
                duplicatesSkipped++;
                break;
            default:
                throw new IllegalStateException("Unexpected classification: " + classification);
        }
    }

    void recordFlush(int rows) {
        insertedRows += rows;
        chunksFlushed++;
    }

    void recordSweep(List<Long> closed, long deleted) {
        this.closedIds = closed;
        this.deletedRows = deleted;
    }
}
