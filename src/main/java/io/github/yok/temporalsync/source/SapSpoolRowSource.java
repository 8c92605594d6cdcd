package io.github.yok.temporalsync.source;

import io.github.yok.temporalsync.core.SourceReadException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Reads an SAP list spool.
 *
 * <p>
 * The spool is rewritten by a {@link SpoolCleaner} into a temporary pipe-delimited file, which is
 * then read as a {@link CsvRowSource} without quoting. The temporary file is deleted when the
 * returned stream is closed.
 * </p>
 */
@Slf4j
@Getter
@Builder
public class SapSpoolRowSource implements RowSource {

    @NonNull
    private final Path path;

    @NonNull
    private final SourceRowNormalizer normalizer;

    // SAP spools are exported in Latin-1
    @Builder.Default
    private final Charset charset = StandardCharsets.ISO_8859_1;

    @Builder.Default
    private final SpoolCleaner cleaner = SpoolCleaner.FIXED_COLUMNS;

    // Lines before the header of a fixed-column spool
    @Builder.Default
    private final int preambleLines = SpoolCleaner.DEFAULT_PREAMBLE_LINES;

    @Override
    public Stream<SourceRow> rows() {
        Path cleaned;
        try {
            cleaned = Files.createTempFile("temporalsync-spool-", ".csv");
        } catch (IOException e) {
            throw new SourceReadException("Failed to create work file for [" + path + "]", e);
        }

        try {
            try (BufferedReader in = Files.newBufferedReader(path, charset);
                    BufferedWriter out = Files.newBufferedWriter(cleaned, charset)) {
                cleaner.clean(in, out, preambleLines);
            }
            log.debug("Spool [{}] cleaned with {} into [{}]", path, cleaner, cleaned);

            CsvRowSource csv = CsvRowSource.builder().path(cleaned).normalizer(normalizer)
                    .charset(charset).delimiter(SpoolCleaner.SEPARATOR).quote(null).header(true)
                    .build();
            return csv.rows().onClose(() -> delete(cleaned));
        } catch (IOException e) {
            SourceReadException failure =
                    new SourceReadException("Failed to clean spool [" + path + "]", e);
            deleteAfterFailure(cleaned, failure);
            throw failure;
        } catch (RuntimeException e) {
            deleteAfterFailure(cleaned, e);
            throw e;
        }
    }

    private static void delete(Path file) {
        try {
            FileUtils.forceDelete(file.toFile());
        } catch (IOException e) {
            throw new SourceReadException("Failed to delete work file [" + file + "]", e);
        }
    }

    private static void deleteAfterFailure(Path file, RuntimeException primary) {
        try {
            FileUtils.forceDelete(file.toFile());
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
