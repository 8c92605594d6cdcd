package io.github.yok.temporalsync.source;

import io.github.yok.temporalsync.config.TableJobConfig;
import io.github.yok.temporalsync.sink.SqlDialect;
import io.github.yok.temporalsync.sink.TableDefinition;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Creates the {@link RowSource} of a table job from its {@code source} settings.
 *
 * <p>
 * When the job does not name a format, it is inferred from the extension of the extract file:
 * </p>
 * <ul>
 * <li>{@code csv}, {@code tsv}, {@code txt}: {@link SourceFormat#CSV}</li>
 * <li>{@code spool}, {@code spl}: {@link SourceFormat#SAP_SPOOL}</li>
 * </ul>
 */
@Slf4j
public class RowSourceFactory {

    /**
     * Resolves the format of a source.
     *
     * @param source source settings
     * @return explicit format, or the one matching the file extension
     * @throws IllegalArgumentException if neither is available
     */
    public static SourceFormat resolveFormat(TableJobConfig.Source source) {
        if (source.getFormat() != null) {
            return source.getFormat();
        }
        if (StringUtils.isNotBlank(source.getTable())) {
            return SourceFormat.TABLE;
        }
        String ext = FilenameUtils.getExtension(source.getPath());
        for (SourceFormat format : SourceFormat.values()) {
            if (format.matches(ext)) {
                return format;
            }
        }
        throw new IllegalArgumentException(
                "Cannot infer source format of [" + source.getPath() + "]; set source.format");
    }

    /**
     * Creates the row source of a job.
     *
     * @param job table job
     * @param table target table layout
     * @param sourceConnection open connection for {@link SourceFormat#TABLE}, otherwise ignored
     * @param sourceDialect dialect of {@code sourceConnection}, otherwise ignored
     * @return row source
     * @throws IllegalArgumentException if the source settings are incomplete
     */
    public static RowSource create(TableJobConfig.Job job, TableDefinition table,
            Connection sourceConnection, SqlDialect sourceDialect) {
        TableJobConfig.Source source = job.getSource();
        SourceFormat format = resolveFormat(source);
        DateTimeFormatter datePattern = StringUtils.isBlank(source.getDatePattern()) ? null
                : DateTimeFormatter.ofPattern(source.getDatePattern());
        SourceRowNormalizer normalizer = new SourceRowNormalizer(table, source.getColumnMap(),
                datePattern, source.isRequireAllColumns());
        log.debug("Job [{}] reads its extract as {}", job.getId(), format);

        switch (format) {
            case CSV:
                return CsvRowSource.builder()
                        .path(requirePath(job))
                        .normalizer(normalizer)
                        .charset(charset(source, StandardCharsets.UTF_8))
                        .delimiter(delimiter(source))
                        .skipRows(source.getSkipRows())
                        .header(source.isHeader())
                        .build();

            case SAP_SPOOL:
                return SapSpoolRowSource.builder()
                        .path(requirePath(job))
                        .normalizer(normalizer)
                        .charset(charset(source, StandardCharsets.ISO_8859_1))
                        .cleaner(SpoolCleaner.of(source.getSpoolCleaner()))
                        .preambleLines(source.getPreambleLines() != null
                                ? source.getPreambleLines()
                                : SpoolCleaner.DEFAULT_PREAMBLE_LINES)
                        .build();

            case TABLE:
                if (sourceConnection == null || StringUtils.isBlank(source.getTable())) {
                    throw new IllegalArgumentException("Job [" + job.getId()
                            + "] needs source.connectionId and source.table");
                }
                return JdbcTableRowSource.builder()
                        .connection(sourceConnection)
                        .dialect(sourceDialect)
                        .table(source.getTable())
                        .normalizer(normalizer)
                        .fetchSize(source.getFetchSize() != null ? source.getFetchSize()
                                : JdbcTableRowSource.DEFAULT_FETCH_SIZE)
                        .build();

            default:
                throw new IllegalArgumentException("Unsupported source format: " + format);
        }
    }

    private static Path requirePath(TableJobConfig.Job job) {
        String path = job.getSource().getPath();
        if (StringUtils.isBlank(path)) {
            throw new IllegalArgumentException("Job [" + job.getId() + "] has no source.path");
        }
        return Paths.get(path);
    }

    private static Charset charset(TableJobConfig.Source source, Charset fallback) {
        return StringUtils.isBlank(source.getEncoding()) ? fallback
                : Charset.forName(source.getEncoding());
    }

    private static char delimiter(TableJobConfig.Source source) {
        String delimiter = source.getDelimiter();
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter)) {
            return '\t';
        }
        if (delimiter == null || delimiter.length() != 1) {
            throw new IllegalArgumentException(
                    "source.delimiter must be a single character: [" + delimiter + "]");
        }
        return delimiter.charAt(0);
    }
}
