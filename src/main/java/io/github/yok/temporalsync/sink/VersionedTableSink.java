package io.github.yok.temporalsync.sink;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Storage boundary of the synchronization engine: the minimal set of operations on a
 * system-versioned table.
 *
 * <p>
 * All operations are expected to run inside one transaction controlled by the caller. The engine
 * never commits, rolls back or closes the underlying resource.
 * </p>
 */
public interface VersionedTableSink {

    /**
     * Streams the currently-valid versions, i.e. the rows whose {@code valid_to} equals the
     * sentinel date. The stream is evaluated lazily and must be closed by the caller.
     *
     * @return lazily evaluated stream of current versions, each carrying its surrogate id
     * @throws io.github.yok.temporalsync.core.SinkException on I/O failure
     */
    Stream<VersionedRecord> scanCurrent();

    /**
     * Appends new versions. Surrogate ids are assigned by the sink.
     *
     * @param rows pending versions (ids are ignored)
     * @throws io.github.yok.temporalsync.core.SinkException on I/O failure
     */
    void insertBatch(List<VersionedRecord> rows);

    /**
     * Sets {@code valid_to = asOf} on exactly the given versions.
     *
     * @param ids surrogate ids to close
     * @param asOf as-of date of the run
     * @throws io.github.yok.temporalsync.core.SinkException on I/O failure or when an id does not
     *         match exactly one version
     */
    void closeBatch(Collection<Long> ids, LocalDate asOf);
}
