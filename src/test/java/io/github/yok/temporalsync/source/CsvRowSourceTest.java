package io.github.yok.temporalsync.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.temporalsync.core.SourceReadException;
import io.github.yok.temporalsync.sink.ColumnDefinition;
import io.github.yok.temporalsync.sink.ColumnType;
import io.github.yok.temporalsync.sink.TableDefinition;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvRowSourceTest {

    private static final TableDefinition TABLE = new TableDefinition("product",
            List.of(ColumnDefinition.varchar("code", 10),
                    ColumnDefinition.of("name", ColumnType.TEXT),
                    ColumnDefinition.of("qty", ColumnType.INTEGER),
                    ColumnDefinition.of("since", ColumnType.DATE)),
            List.of("code"));

    @TempDir
    Path tempDir;

    private Path write(Charset charset, String... lines) throws Exception {
        Path file = tempDir.resolve("extract.csv");
        Files.write(file, Arrays.asList(lines), charset);
        return file;
    }

    private static List<SourceRow> read(CsvRowSource source) {
        try (Stream<SourceRow> rows = source.rows()) {
            return rows.collect(Collectors.toList());
        }
    }

    private static Map<String, Object> values(Object... pairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put((String) pairs[i], pairs[i + 1]);
        }
        return values;
    }

    @Test
    void rows_正常ケース_ヘッダ付きCSV_列の型に変換された行が返ること() throws Exception {
        Path file = write(StandardCharsets.UTF_8, "code,name,qty,since,unused",
                "A, Apple ,10,2024-01-31,x", "\"B,1\",,,,y");
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        List<SourceRow> rows = read(source);

        assertEquals(2, rows.size());
        assertEquals(values("code", "A", "name", "Apple", "qty", 10L, "since",
                LocalDate.of(2024, 1, 31)), rows.get(0).asMap());
        assertEquals(values("code", "B,1", "name", null, "qty", null, "since", null),
                rows.get(1).asMap());
    }

    @Test
    void rows_正常ケース_読み飛ばし行とタブ区切りと列名変換_指定どおりに読まれること() throws Exception {
        Path file = write(Charset.forName("windows-1252"), "Exported 2024-03-01", "",
                "Código\tDescrição\tQtd\tData", "A\tMaçã\t3\t01/03/2024");
        SourceRowNormalizer normalizer = new SourceRowNormalizer(TABLE,
                Map.of("Código", "code", "Descrição", "name", "Qtd", "qty", "Data", "since"),
                DateTimeFormatter.ofPattern("dd/MM/yyyy"));
        CsvRowSource source = CsvRowSource.builder().path(file).normalizer(normalizer)
                .charset(Charset.forName("windows-1252")).delimiter('\t').skipRows(2).build();

        List<SourceRow> rows = read(source);

        assertEquals(List.of(new SourceRow(values("code", "A", "name", "Maçã", "qty", 3L,
                "since", LocalDate.of(2024, 3, 1)))), rows);
    }

    @Test
    void rows_正常ケース_ヘッダなし_宣言順の列に位置で対応付くこと() throws Exception {
        Path file = write(StandardCharsets.UTF_8, "A,Apple,10", "B,Banana");
        CsvRowSource source = CsvRowSource.builder().path(file)
                .normalizer(new SourceRowNormalizer(TABLE)).header(false).build();

        List<SourceRow> rows = read(source);

        assertEquals(values("code", "A", "name", "Apple", "qty", 10L, "since", null),
                rows.get(0).asMap());
        assertEquals(values("code", "B", "name", "Banana", "qty", null, "since", null),
                rows.get(1).asMap());
    }

    @Test
    void rows_正常ケース_ヘッダのみのCSV_行が返らないこと() throws Exception {
        Path file = write(StandardCharsets.UTF_8, "code,name,qty,since");
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        assertTrue(read(source).isEmpty());
    }

    @Test
    void rows_異常ケース_空のファイル_SourceReadExceptionが送出されること() throws Exception {
        Path file = write(StandardCharsets.UTF_8);
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        SourceReadException ex = assertThrows(SourceReadException.class, source::rows);
        assertEquals("File [" + file + "] has no header line", ex.getMessage());
    }

    @Test
    void rows_異常ケース_列名が変わった列がある_行を返さずSourceReadExceptionが送出されること()
            throws Exception {
        Path file = write(StandardCharsets.UTF_8, "code,Product name,qty,since", "A,Apple,1,");
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        SourceReadException ex = assertThrows(SourceReadException.class, source::rows);
        assertEquals("Source of table [product] does not provide column(s) [name]; header was "
                + "[code, Product name, qty, since]", ex.getMessage());
    }

    @Test
    void rows_異常ケース_整数列に文字列_SourceReadExceptionが送出されること() throws Exception {
        Path file = write(StandardCharsets.UTF_8, "code,name,qty,since", "A,,1,", "B,,many,");
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        SourceReadException ex = assertThrows(SourceReadException.class, () -> read(source));
        assertTrue(ex.getMessage().startsWith("Invalid value in [" + file + "], record 3, "
                + "column [qty]: Value [many] is not a valid INTEGER"), ex.getMessage());
    }

    @Test
    void rows_異常ケース_ファイルが存在しない_SourceReadExceptionが送出されること() {
        Path file = tempDir.resolve("missing.csv");
        CsvRowSource source =
                CsvRowSource.builder().path(file).normalizer(new SourceRowNormalizer(TABLE)).build();

        SourceReadException ex = assertThrows(SourceReadException.class, source::rows);
        assertEquals("Failed to open [" + file + "]", ex.getMessage());
    }

    @Test
    void rows_正常ケース_2回呼び出す_毎回先頭から読まれること() throws Exception {
        Path file = write(StandardCharsets.UTF_8, "code", "A", "B");
        CsvRowSource source = CsvRowSource.builder().path(file)
                .normalizer(new SourceRowNormalizer(TABLE, null, null, false)).build();

        assertEquals(2, read(source).size());
        assertEquals(2, read(source).size());
    }
}
