package io.github.yok.temporalsync.core;

/**
 * Thrown when a source row lacks a value for one of the natural-key columns.
 *
 * <p>
 * Skipping such a row would make its entity look deleted to the obsolescence sweep, so the run
 * stops instead.
 * </p>
 */
public class MalformedSourceRowException extends TemporalSyncException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param rowNumber one-based position of the row in the source
     * @param column natural-key column that is missing or null
     */
    public MalformedSourceRowException(long rowNumber, String column) {
        super("Source row " + rowNumber + " has no value for natural-key column [" + column
                + "]");
    }
}
