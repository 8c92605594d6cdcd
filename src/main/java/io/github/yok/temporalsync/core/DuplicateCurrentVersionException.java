package io.github.yok.temporalsync.core;

/**
 * Thrown when the target holds more than one currently-valid version for a natural key.
 *
 * <p>
 * This indicates a corrupted target. The run stops before any mutation is issued.
 * </p>
 */
public class DuplicateCurrentVersionException extends TemporalSyncException {

    private static final long serialVersionUID = 1L;

    // Natural key found twice in the currently-valid slice
    private final NaturalKey naturalKey;

    /**
     * Creates the exception.
     *
     * @param naturalKey duplicated natural key
     * @param firstId surrogate id seen first
     * @param secondId surrogate id seen second
     */
    public DuplicateCurrentVersionException(NaturalKey naturalKey, Long firstId, Long secondId) {
        super("More than one current version for natural key " + naturalKey + " (ids " + firstId
                + ", " + secondId + ")");
        this.naturalKey = naturalKey;
    }

    public NaturalKey getNaturalKey() {
        return naturalKey;
    }
}
