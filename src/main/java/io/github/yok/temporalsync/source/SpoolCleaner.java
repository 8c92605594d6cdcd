package io.github.yok.temporalsync.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of strategies that turn an SAP list spool into a pipe-delimited file with one header
 * line.
 *
 * <p>
 * Strategies are resolved by name through {@link #of(String)}. Both the enum name and the
 * historical job-file alias are accepted.
 * </p>
 */
@Slf4j
public enum SpoolCleaner {

    /**
     * Fixed-column list output.
     *
     * <p>
     * Skips the spool preamble, takes the next line as header, then drops repeated header lines
     * and lines with fewer separators than the header. Separators found at positions where the
     * header has none are part of a value and are replaced with a blank.
     * </p>
     */
    FIXED_COLUMNS("clean_fixed_sap_spool") {
        @Override
        public void clean(BufferedReader in, Writer out, int preambleLines) throws IOException {
            for (int i = 0; i < preambleLines; i++) {
                if (in.readLine() == null) {
                    return;
                }
            }
            String header = in.readLine();
            if (header == null) {
                return;
            }
            List<Integer> headerPositions = separatorPositions(header);
            Set<Integer> headerPositionSet = new HashSet<>(headerPositions);
            out.write(header);
            out.write('\n');
            log.debug("Line {} used as spool header; {} column(s)", preambleLines + 1,
                    headerPositions.size() + 1);

            int lineNumber = preambleLines + 1;
            String line;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                List<Integer> positions = separatorPositions(line);
                if (line.equals(header) || positions.size() < headerPositions.size()) {
                    continue;
                }
                if (positions.size() > headerPositions.size()) {
                    char[] chars = line.toCharArray();
                    for (int p : positions) {
                        if (!headerPositionSet.contains(p)) {
                            log.debug("Replacing extra separator at line {}, position {}",
                                    lineNumber, p + 1);
                            chars[p] = ' ';
                        }
                    }
                    line = new String(chars);
                }
                out.write(line);
                out.write('\n');
            }
        }
    },

    /**
     * CM07 work-center capacity report.
     *
     * <p>
     * Each group starts with a heading naming the work center, its description and plant. Data
     * lines (starting with blanks then a separator) are prefixed with those three fields.
     * </p>
     */
    WORK_CENTER_CAPACITY("clean_cm07_spool") {

        private final Pattern headingPattern =
                Pattern.compile("^Centro trab\\.\\s+(\\w+)\\s+([\\S\\s]+)Cent\\..+(.{4})$");

        private final Pattern dataPattern = Pattern.compile("^\\s+\\|");

        @Override
        public void clean(BufferedReader in, Writer out, int preambleLines) throws IOException {
            out.write("Centro trab|Descricao|Centro|Dia|Necessidade|Capacid.útil|Carga"
                    + "|Capac.livre|Unid.\n");
            String groupFields = null;
            String line;
            while ((line = in.readLine()) != null) {
                Matcher heading = headingPattern.matcher(line);
                if (heading.find()) {
                    groupFields = String.join(String.valueOf(SEPARATOR), heading.group(1),
                            heading.group(2), heading.group(3));
                }
                if (dataPattern.matcher(line).find()) {
                    if (groupFields == null) {
                        log.debug("Capacity line before any work-center heading skipped: {}",
                                line);
                        continue;
                    }
                    out.write(groupFields);
                    out.write(line.strip());
                    out.write('\n');
                }
            }
        }
    };

    /** Column separator of a cleaned spool. */
    public static final char SEPARATOR = '|';

    /** Preamble length of a fixed-column spool when the job does not set one. */
    public static final int DEFAULT_PREAMBLE_LINES = 66;

    // Name used in job files written for the former loader
    private final String alias;

    SpoolCleaner(String alias) {
        this.alias = alias;
    }

    /**
     * Rewrites a spool.
     *
     * @param in spool content
     * @param out cleaned, pipe-delimited content with a header line
     * @param preambleLines lines to skip before the header, where the layout has a preamble
     * @throws IOException on read or write failure
     */
    public abstract void clean(BufferedReader in, Writer out, int preambleLines)
            throws IOException;

    /**
     * Resolves a strategy by enum name or alias, ignoring case.
     *
     * @param name strategy name, e.g. {@code FIXED_COLUMNS} or {@code clean_cm07_spool}
     * @return strategy
     * @throws IllegalArgumentException if no strategy has that name
     */
    public static SpoolCleaner of(String name) {
        if (name != null) {
            for (SpoolCleaner cleaner : values()) {
                if (cleaner.name().equalsIgnoreCase(name.trim())
                        || cleaner.alias.equalsIgnoreCase(name.trim())) {
                    return cleaner;
                }
            }
        }
        List<String> known = new ArrayList<>();
        for (SpoolCleaner cleaner : values()) {
            known.add(cleaner.name().toLowerCase(Locale.ROOT));
        }
        throw new IllegalArgumentException(
                "Unknown spool cleaner [" + name + "]; expected one of " + known);
    }

    static List<Integer> separatorPositions(String line) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == SEPARATOR) {
                positions.add(i);
            }
        }
        return positions;
    }
}
