/**
 * Utility package for TemporalSync.
 *
 * <p>
 * Currently holds the batch error reporting used at the CLI boundary.
 * </p>
 */
package io.github.yok.temporalsync.util;
