package io.github.yok.temporalsync.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Kinds of current-state extract a table job can read.
 *
 * <p>
 * File-based formats declare the extensions used to infer the format when a job does not name
 * one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceFormat {

    // Delimited flat file
    CSV("csv", "tsv", "txt"),

    // SAP list spool, cleaned before it is read as a pipe-delimited file
    SAP_SPOOL("spool", "spl"),

    // Table of another JDBC connection
    TABLE;

    // Set of recognized extensions for this format (all lowercase)
    private final Set<String> extensions;

    SourceFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }
}
