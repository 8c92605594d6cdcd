package io.github.yok.temporalsync.config;

/**
 * Decides what happens when one source extract contains the same natural key more than once.
 *
 * <ul>
 * <li>FAIL: stop the run with
 * {@link io.github.yok.temporalsync.core.DuplicateNaturalKeyException}</li>
 * <li>KEEP_FIRST: keep the first occurrence and skip the later ones with a warning</li>
 * </ul>
 */
public enum DuplicateKeyPolicy {
    // Abort the run on the first repeated key
    FAIL,
    // Keep the first row of a key; later rows of the same key are skipped
    KEEP_FIRST
}
