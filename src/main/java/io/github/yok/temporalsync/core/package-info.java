/**
 * Temporal-table synchronization engine.
 *
 * <p>
 * Reconciles a full current-state extract against a system-versioned table: the version cache is
 * built from the current slice, each source row is classified as new, modified or unchanged, and a
 * final sweep closes superseded and vanished versions. All of a run's mutable state lives in one
 * {@link io.github.yok.temporalsync.core.RunState}.
 * </p>
 *
 * <p>
 * The engine talks to storage only through {@link io.github.yok.temporalsync.sink} and never
 * depends on an SQL dialect. {@link io.github.yok.temporalsync.core.SyncJobRunner} wires it to JDBC
 * connections and configured extracts.
 * </p>
 */
package io.github.yok.temporalsync.core;
