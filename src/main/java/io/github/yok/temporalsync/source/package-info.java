/**
 * Readers of current-state extracts: delimited files, SAP list spools and tables of another
 * connection, plus the header and value normalization they share.
 */
package io.github.yok.temporalsync.source;
