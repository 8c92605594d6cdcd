/**
 * Storage side of the engine: the versioned-table boundary and its JDBC implementation.
 *
 * <p>
 * Dialect differences (identifier quoting, identity columns, physical types) are kept in
 * {@link io.github.yok.temporalsync.sink.SqlDialect}.
 * </p>
 */
package io.github.yok.temporalsync.sink;
