package io.github.yok.temporalsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.temporalsync.sink.SystemColumns;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RowHasherTest {

    private final RowHasher hasher = new RowHasher();

    private final List<String> key = List.of("code");

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    void hash_正常ケース_任意の行を指定する_小文字16進64桁が返ること() {
        String digest = hasher.hash(row("code", "A", "name", "x"), key, SystemColumns.DEFAULT);
        assertEquals(64, digest.length());
        assertTrue(digest.matches("[0-9a-f]{64}"));
    }

    @Test
    void hash_正常ケース_列順が異なる_同じダイジェストになること() {
        String a = hasher.hash(row("code", "A", "name", "x", "qty", 1L), key,
                SystemColumns.DEFAULT);
        String b = hasher.hash(row("qty", 1L, "name", "x", "code", "A"), key,
                SystemColumns.DEFAULT);
        assertEquals(a, b);
    }

    @Test
    void hash_正常ケース_前後の空白と型表現のみ異なる_同じダイジェストになること() {
        String a = hasher.hash(row("code", "A", "name", "x", "qty", 1L, "price",
                new BigDecimal("1.50")), key, SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "name", "  x ", "qty", "1", "price", 1.5d), key,
                SystemColumns.DEFAULT);
        assertEquals(a, b);
    }

    @Test
    void hash_正常ケース_列名の大文字小文字のみ異なる_同じダイジェストになること() {
        String a = hasher.hash(row("Code", "A", "Name", "x"), List.of("Code"),
                SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "name", "x"), key, SystemColumns.DEFAULT);
        assertEquals(a, b);
    }

    @Test
    void hash_異常ケース_大文字小文字のみ異なる列が2つある_IllegalArgumentExceptionが送出されること() {
        Map<String, Object> row = row("code", "A", "name", "x", "NAME", "y");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> hasher.hash(row, key, SystemColumns.DEFAULT));
        assertEquals("column names differ only by case: [code, name, NAME]", ex.getMessage());
    }

    @Test
    void hash_正常ケース_システム列と自然キーのみ異なる_同じダイジェストになること() {
        String a = hasher.hash(row("id", 1L, "code", "A", "name", "x", "valid_from",
                LocalDate.of(2024, 1, 1), "valid_to", LocalDate.of(2999, 12, 31)), key,
                SystemColumns.DEFAULT);
        String b = hasher.hash(row("id", 9L, "code", "B", "name", "x", "valid_from",
                LocalDate.of(2025, 1, 1), "valid_to", LocalDate.of(2025, 6, 1)), key,
                SystemColumns.DEFAULT);
        assertEquals(a, b);
    }

    @Test
    void hash_正常ケース_null列と欠落列_同じダイジェストになること() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("code", "A");
        withNull.put("name", "x");
        withNull.put("note", null);
        String a = hasher.hash(withNull, key, SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "name", "x", "blank", " "), key,
                SystemColumns.DEFAULT);
        String c = hasher.hash(row("code", "A", "name", "x"), key, SystemColumns.DEFAULT);
        assertEquals(c, a);
        assertEquals(c, b);
    }

    @Test
    void hash_正常ケース_ペイロードが異なる_異なるダイジェストになること() {
        String a = hasher.hash(row("code", "A", "name", "x"), key, SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "name", "y"), key, SystemColumns.DEFAULT);
        assertNotEquals(a, b);
    }

    @Test
    void hash_正常ケース_隣接値の境界のみ異なる_異なるダイジェストになること() {
        String a = hasher.hash(row("code", "A", "a", "xy", "b", "z"), key, SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "a", "x", "b", "yz"), key, SystemColumns.DEFAULT);
        assertNotEquals(a, b);
    }

    @Test
    void hash_正常ケース_値が同じで列名が異なる_異なるダイジェストになること() {
        String a = hasher.hash(row("code", "A", "name", "x"), key, SystemColumns.DEFAULT);
        String b = hasher.hash(row("code", "A", "label", "x"), key, SystemColumns.DEFAULT);
        assertNotEquals(a, b);
    }

    @Test
    void hash_正常ケース_独自のシステム列名を指定する_それらの列が除外されること() {
        SystemColumns custom = new SystemColumns("id", "SysStartDate", "SysEndDate");
        String a = hasher.hash(row("code", "A", "name", "x", "SysEndDate",
                LocalDate.of(2024, 1, 1)), key, custom);
        String b = hasher.hash(row("code", "A", "name", "x"), key, custom);
        assertEquals(a, b);
    }
}
