package io.github.yok.temporalsync.core;

import io.github.yok.temporalsync.sink.VersionedRecord;
import io.github.yok.temporalsync.sink.VersionedTableSink;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Digest and surrogate id of every currently-valid version in the target, keyed by natural key.
 *
 * <p>
 * Built once per run from a single streamed scan of the current slice, so the target is never
 * re-read per source row. The cache belongs to exactly one run and is discarded with it.
 * </p>
 */
@Slf4j
public final class VersionCache {

    private final Map<NaturalKey, CachedVersion> entries;

    private VersionCache(Map<NaturalKey, CachedVersion> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Scans the currently-valid versions of the sink and caches their digests.
     *
     * <p>
     * The scan is consumed record by record; only the key, digest and id of each row are kept.
     * </p>
     *
     * @param sink target table
     * @param options run options (natural key, system columns)
     * @param hasher row hasher
     * @return populated cache
     * @throws DuplicateCurrentVersionException if a natural key has more than one current version
     * @throws SinkException if the scan fails
     */
    public static VersionCache build(VersionedTableSink sink, SyncOptions options,
            RowHasher hasher) {
        log.debug("Loading version cache (naturalKey={})", options.getNaturalKey());

        Map<NaturalKey, CachedVersion> entries = new HashMap<>();
        try (Stream<VersionedRecord> current = sink.scanCurrent()) {
            Iterator<VersionedRecord> it = current.iterator();
            while (it.hasNext()) {
                VersionedRecord record = it.next();
                NaturalKey key = NaturalKey.of(record.getValues(), options.getNaturalKey());
                String digest = hasher.hash(record.getValues(), options.getNaturalKey(),
                        options.getSystemColumns());

                CachedVersion previous = entries.putIfAbsent(key,
                        new CachedVersion(digest, record.getId()));
                if (previous != null) {
                    throw new DuplicateCurrentVersionException(key, previous.getId(),
                            record.getId());
                }
            }
        }

        log.debug("Version cache loaded: {} current version(s)", entries.size());
        return new VersionCache(entries);
    }

    /**
     * Creates a cache from prepared entries (for callers that already hold them, and tests).
     *
     * @param entries natural key to current version
     * @return cache
     */
    public static VersionCache of(Map<NaturalKey, CachedVersion> entries) {
        return new VersionCache(new HashMap<>(entries));
    }

    public CachedVersion get(NaturalKey key) {
        return entries.get(key);
    }

    public boolean contains(NaturalKey key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public Map<NaturalKey, CachedVersion> asMap() {
        return entries;
    }
}
