package io.github.yok.temporalsync.source;

import java.util.stream.Stream;

/**
 * Producer of the current-state extract of one table.
 *
 * <p>
 * Each call to {@link #rows()} starts reading from the beginning and returns a lazily evaluated
 * stream. The caller must close the stream so the underlying file or cursor is released.
 * </p>
 */
public interface RowSource {

    /**
     * Opens the source.
     *
     * @return lazily evaluated stream of rows, consumed once front to back
     * @throws io.github.yok.temporalsync.core.SourceReadException if the source cannot be opened
     */
    Stream<SourceRow> rows();
}
