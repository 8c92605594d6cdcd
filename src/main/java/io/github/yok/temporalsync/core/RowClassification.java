package io.github.yok.temporalsync.core;

/**
 * Outcome of comparing one source row with the version cache.
 */
public enum RowClassification {
    // Key not in the cache: first version is inserted
    NEW,
    // Key cached with a different digest: new version inserted, cached version closed
    MODIFIED,
    // Key cached with the same digest: nothing to do
    UNCHANGED,
    // Repeated key skipped under DuplicateKeyPolicy.KEEP_FIRST
    DUPLICATE_SKIPPED
}
