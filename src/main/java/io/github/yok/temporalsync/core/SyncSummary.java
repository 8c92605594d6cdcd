package io.github.yok.temporalsync.core;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters of one finished synchronization run.
 */
@Getter
@Builder
@ToString
public class SyncSummary {

    private final long rowsRead;
    private final long newRows;
    private final long modifiedRows;
    private final long unchangedRows;
    private final long deletedRows;
    private final long duplicatesSkipped;
    private final long insertedRows;
    private final int chunksFlushed;
    private final List<Long> closedIds;
    private final long elapsedMillis;

    /**
     * Returns whether the run issued no insert and no close.
     *
     * @return {@code true} if the target was left untouched
     */
    public boolean isNoop() {
        return insertedRows == 0 && closedIds.isEmpty();
    }

    static SyncSummary of(RunState state, long elapsedMillis) {
        return SyncSummary.builder()
                .rowsRead(state.getRowsRead())
                .newRows(state.getNewRows())
                .modifiedRows(state.getModifiedRows())
                .unchangedRows(state.getUnchangedRows())
                .deletedRows(state.getDeletedRows())
                .duplicatesSkipped(state.getDuplicatesSkipped())
                .insertedRows(state.getInsertedRows())
                .chunksFlushed(state.getChunksFlushed())
                .closedIds(List.copyOf(state.getClosedIds()))
                .elapsedMillis(elapsedMillis)
                .build();
    }
}
