package io.github.yok.temporalsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.temporalsync.sink.SystemColumns;
import io.github.yok.temporalsync.sink.VersionedRecord;
import io.github.yok.temporalsync.sink.VersionedTableSink;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class VersionCacheTest {

    private static final LocalDate DAY1 = LocalDate.of(2024, 1, 1);

    private final RowHasher hasher = new RowHasher();

    private final SyncOptions options =
            SyncOptions.builder().naturalKeyColumn("code").asOf(LocalDate.of(2024, 2, 1)).build();

    @Test
    void build_正常ケース_現行版のみを走査する_キーごとにダイジェストとIDが保持されること() {
        InMemoryVersionedTableSink sink = new InMemoryVersionedTableSink();
        long idA = sink.seedCurrent(Map.of("code", "A", "name", "x"), DAY1);
        sink.seed(Map.of("code", "B", "name", "old"), DAY1, LocalDate.of(2024, 1, 15));
        long idB = sink.seedCurrent(Map.of("code", "B", "name", "new"), LocalDate.of(2024, 1, 15));

        VersionCache cache = VersionCache.build(sink, options, hasher);

        assertEquals(2, cache.size());
        CachedVersion a = cache.get(NaturalKey.ofValues("A"));
        assertEquals(idA, a.getId());
        assertEquals(hasher.hash(Map.of("code", "A", "name", "x"), List.of("code"),
                SystemColumns.DEFAULT), a.getDigest());
        assertEquals(idB, cache.get(NaturalKey.ofValues("B")).getId());
        assertTrue(cache.contains(NaturalKey.ofValues("B")));
        assertFalse(cache.contains(NaturalKey.ofValues("C")));
        assertNull(cache.get(NaturalKey.ofValues("C")));
        assertEquals(1, sink.getScans());
        assertEquals(0, sink.getOpenScans());
    }

    @Test
    void build_正常ケース_空のテーブルを走査する_空のキャッシュが返ること() {
        VersionCache cache = VersionCache.build(new InMemoryVersionedTableSink(), options, hasher);
        assertEquals(0, cache.size());
    }

    @Test
    void build_異常ケース_同じキーの現行版が2件ある_DuplicateCurrentVersionExceptionが送出されること() {
        InMemoryVersionedTableSink sink = new InMemoryVersionedTableSink();
        sink.seedCurrent(Map.of("code", "A", "name", "x"), DAY1);
        sink.seedCurrent(Map.of("code", "A", "name", "y"), DAY1);

        DuplicateCurrentVersionException ex = assertThrows(DuplicateCurrentVersionException.class,
                () -> VersionCache.build(sink, options, hasher));

        assertEquals(NaturalKey.ofValues("A"), ex.getNaturalKey());
        assertEquals("More than one current version for natural key (A) (ids 1, 2)",
                ex.getMessage());
        assertEquals(0, sink.getOpenScans());
    }

    @Test
    void build_異常ケース_走査中に失敗する_ストリームがクローズされ例外が伝播すること() {
        AtomicBoolean closed = new AtomicBoolean();
        VersionedTableSink sink = mock(VersionedTableSink.class);
        Stream<VersionedRecord> failing = Stream.<VersionedRecord>generate(() -> {
            throw new SinkException("cursor lost", new IllegalStateException());
        }).onClose(() -> closed.set(true));
        when(sink.scanCurrent()).thenReturn(failing);

        assertThrows(SinkException.class, () -> VersionCache.build(sink, options, hasher));
        assertTrue(closed.get());
    }
}
