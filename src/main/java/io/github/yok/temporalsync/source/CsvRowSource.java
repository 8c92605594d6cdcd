package io.github.yok.temporalsync.source;

import io.github.yok.temporalsync.core.SourceReadException;
import io.github.yok.temporalsync.sink.ColumnDefinition;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads a delimited flat file with Apache Commons CSV.
 *
 * <p>
 * {@code skipRows} lines are discarded before parsing starts. With {@code header = true} the first
 * record names the columns and goes through {@link SourceRowNormalizer#resolveHeader(List)};
 * otherwise fields are assigned to the table columns by position. Every field is converted to the
 * type of its column.
 * </p>
 */
@Slf4j
@Getter
@Builder
public class CsvRowSource implements RowSource {

    @NonNull
    private final Path path;

    @NonNull
    private final SourceRowNormalizer normalizer;

    @Builder.Default
    private final Charset charset = StandardCharsets.UTF_8;

    @Builder.Default
    private final char delimiter = ',';

    // null disables quoting, as in spool exports where '"' is ordinary text
    @Builder.Default
    private final Character quote = '"';

    // Lines discarded before the header (or the first record)
    @Builder.Default
    private final int skipRows = 0;

    // Whether the first record names the columns
    @Builder.Default
    private final boolean header = true;

    @Override
    public Stream<SourceRow> rows() {
        BufferedReader reader = null;
        try {
            reader = Files.newBufferedReader(path, charset);
            for (int i = 0; i < skipRows; i++) {
                if (reader.readLine() == null) {
                    break;
                }
            }
            CSVParser parser = csvFormat().parse(reader);
            Iterator<CSVRecord> records = parser.iterator();
            List<ColumnDefinition> columns = resolveColumns(records);
            log.debug("Reading [{}] ({} column(s) mapped)", path, columns.stream()
                    .filter(c -> c != null).count());

            Iterator<SourceRow> rows = new Iterator<SourceRow>() {
                @Override
                public boolean hasNext() {
                    try {
                        return records.hasNext();
                    } catch (UncheckedIOException e) {
                        throw new SourceReadException("Failed to read [" + path + "]", e);
                    }
                }

                @Override
                public SourceRow next() {
                    try {
                        return toRow(records.next(), columns);
                    } catch (UncheckedIOException e) {
                        throw new SourceReadException("Failed to read [" + path + "]", e);
                    }
                }
            };
            return StreamSupport
                    .stream(Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED), false)
                    .onClose(() -> {
                        try {
                            parser.close();
                        } catch (IOException e) {
                            throw new SourceReadException("Failed to close [" + path + "]", e);
                        }
                    });
        } catch (IOException e) {
            closeAfterFailure(reader, e);
            throw new SourceReadException("Failed to open [" + path + "]", e);
        } catch (RuntimeException e) {
            closeAfterFailure(reader, e);
            throw e;
        }
    }

    CSVFormat csvFormat() {
        return CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setQuote(quote)
                .setIgnoreEmptyLines(true).get();
    }

    private List<ColumnDefinition> resolveColumns(Iterator<CSVRecord> records) {
        if (!header) {
            return normalizer.getTable().getColumns();
        }
        if (!records.hasNext()) {
            throw new SourceReadException("File [" + path + "] has no header line");
        }
        return normalizer.resolveHeader(records.next().toList());
    }

    private SourceRow toRow(CSVRecord record, List<ColumnDefinition> columns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            ColumnDefinition column = columns.get(i);
            if (column == null) {
                continue;
            }
            String text = i < record.size() ? record.get(i) : null;
            try {
                values.put(column.getName(), normalizer.convert(column, text));
            } catch (IllegalArgumentException e) {
                throw new SourceReadException("Invalid value in [" + path + "], record "
                        + record.getRecordNumber() + ", column [" + column.getName() + "]: "
                        + e.getMessage(), e);
            }
        }
        return new SourceRow(values);
    }

    private static void closeAfterFailure(BufferedReader reader, Exception primary) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
