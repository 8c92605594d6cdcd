package io.github.yok.temporalsync.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.temporalsync.H2TestSupport;
import io.github.yok.temporalsync.core.SourceReadException;
import io.github.yok.temporalsync.sink.ColumnDefinition;
import io.github.yok.temporalsync.sink.ColumnType;
import io.github.yok.temporalsync.sink.SqlDialect;
import io.github.yok.temporalsync.sink.TableDefinition;
import java.sql.Connection;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcTableRowSourceTest {

    private static final TableDefinition TABLE = new TableDefinition("product",
            List.of(ColumnDefinition.varchar("code", 10),
                    ColumnDefinition.of("name", ColumnType.TEXT),
                    ColumnDefinition.of("qty", ColumnType.INTEGER),
                    ColumnDefinition.of("since", ColumnType.DATE)),
            List.of("code"));

    private Connection jdbc;

    @BeforeEach
    void setUp() throws Exception {
        jdbc = H2TestSupport.open(H2TestSupport.newUrl());
        H2TestSupport.execute(jdbc,
                "CREATE TABLE SRC (CODE VARCHAR(10), PRODUCT_NAME VARCHAR(50), QTY INTEGER, "
                        + "SINCE DATE, NOTE VARCHAR(20))",
                "INSERT INTO SRC VALUES ('A', ' Apple ', 10, DATE '2024-01-31', 'x')",
                "INSERT INTO SRC VALUES ('B', '   ', NULL, NULL, NULL)");
    }

    @AfterEach
    void tearDown() throws Exception {
        jdbc.close();
    }

    private JdbcTableRowSource source(String table) {
        return JdbcTableRowSource.builder().connection(jdbc).dialect(SqlDialect.H2).table(table)
                .normalizer(new SourceRowNormalizer(TABLE, Map.of("PRODUCT_NAME", "name"), null))
                .fetchSize(1).build();
    }

    @Test
    void rows_正常ケース_別テーブルを読む_対象列の型で読まれ文字列が整形されること() {
        List<SourceRow> rows;
        try (Stream<SourceRow> stream = source("SRC").rows()) {
            rows = stream.collect(Collectors.toList());
        }
        rows.sort(Comparator.comparing(row -> (String) row.get("code")));

        assertEquals(2, rows.size());
        SourceRow first = rows.get(0);
        assertEquals("A", first.get("code"));
        assertEquals("Apple", first.get("name"));
        assertEquals(10L, first.get("qty"));
        assertEquals(LocalDate.of(2024, 1, 31), first.get("since"));
        assertTrue(first.hasColumn("since"));
        assertEquals(4, first.columns().size());

        SourceRow second = rows.get(1);
        assertNull(second.get("name"));
        assertNull(second.get("qty"));
        assertTrue(second.hasColumn("qty"));
    }

    @Test
    void rows_正常ケース_スキーマ修飾名_各部分が引用されて読まれること() {
        JdbcTableRowSource source = source("PUBLIC.SRC");

        assertEquals("\"PUBLIC\".\"SRC\"", source.qualifiedName());
        try (Stream<SourceRow> stream = source.rows()) {
            assertEquals(2, stream.count());
        }
    }

    @Test
    void rows_異常ケース_テーブルが存在しない_SourceReadExceptionが送出されること() {
        SourceReadException ex =
                assertThrows(SourceReadException.class, () -> source("MISSING").rows());
        assertEquals("Failed to query source table [MISSING]", ex.getMessage());
    }

    @Test
    void rows_異常ケース_自然キー列がない_SourceReadExceptionが送出されること() throws Exception {
        H2TestSupport.execute(jdbc, "CREATE TABLE NOKEY (PRODUCT_NAME VARCHAR(50))");

        assertThrows(SourceReadException.class, () -> source("NOKEY").rows());
    }
}
