/**
 * Configuration classes bound from {@code application.yml}: connections, shared run settings and
 * table jobs.
 */
package io.github.yok.temporalsync.config;
