package io.github.yok.temporalsync.core;

/**
 * Thrown when one source extract contains the same natural key twice and the run is configured
 * with {@link io.github.yok.temporalsync.config.DuplicateKeyPolicy#FAIL}.
 */
public class DuplicateNaturalKeyException extends TemporalSyncException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param rowNumber one-based position of the repeated row
     * @param naturalKey repeated natural key
     */
    public DuplicateNaturalKeyException(long rowNumber, NaturalKey naturalKey) {
        super("Natural key " + naturalKey + " appears more than once in the source (row "
                + rowNumber + ")");
    }
}
