package io.github.yok.temporalsync.core;

/**
 * Wraps an I/O failure while reading source rows.
 */
public class SourceReadException extends TemporalSyncException {

    private static final long serialVersionUID = 1L;

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
