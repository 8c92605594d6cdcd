package io.github.yok.temporalsync.core;

/**
 * Base class of the failures raised while synchronizing a temporal table.
 *
 * <p>
 * All subclasses are fatal for the current run. The caller is expected to roll back the ambient
 * transaction; nothing in the engine retries or repairs.
 * </p>
 */
public class TemporalSyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public TemporalSyncException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and root cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public TemporalSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
