package io.github.yok.temporalsync.core;

/**
 * Wraps an I/O failure of the versioned-table sink (cache scan, batched insert or close).
 */
public class SinkException extends TemporalSyncException {

    private static final long serialVersionUID = 1L;

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
