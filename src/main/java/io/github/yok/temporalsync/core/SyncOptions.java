package io.github.yok.temporalsync.core;

import com.google.common.base.Preconditions;
import io.github.yok.temporalsync.config.DuplicateKeyPolicy;
import io.github.yok.temporalsync.sink.SystemColumns;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

/**
 * Parameters of one synchronization run.
 *
 * <p>
 * Consumed, not owned, by the engine. {@code naturalKey} and {@code asOf} are required; everything
 * else has a default.
 * </p>
 */
@Getter
@Builder(toBuilder = true)
public class SyncOptions {

    /** Default flush threshold of the pending-insert queue. */
    public static final int DEFAULT_CHUNK_SIZE = 5000;

    /** Default open-ended {@code valid_to} value. */
    public static final LocalDate DEFAULT_SENTINEL_VALID_TO = LocalDate.of(2999, 12, 31);

    // Natural-key column names, in key order
    @Singular("naturalKeyColumn")
    private final List<String> naturalKey;

    // As-of date shared by every insert and close of the run
    @NonNull
    private final LocalDate asOf;

    // Pending inserts are flushed once this many rows are queued
    @Builder.Default
    private final int chunkSize = DEFAULT_CHUNK_SIZE;

    // Close current versions whose key is absent from the source
    @Builder.Default
    private final boolean closeDeletedRows = true;

    // valid_to of current versions
    @Builder.Default
    private final LocalDate sentinelValidTo = DEFAULT_SENTINEL_VALID_TO;

    // Handling of repeated natural keys inside one source
    @Builder.Default
    private final DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.FAIL;

    // Names of id / valid_from / valid_to
    @Builder.Default
    private final SystemColumns systemColumns = SystemColumns.DEFAULT;

    /**
     * Checks the option combination before a run starts.
     *
     * @throws IllegalArgumentException if an option is out of range
     */
    public void validate() {
        Preconditions.checkArgument(!naturalKey.isEmpty(), "naturalKey must not be empty");
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
        Preconditions.checkArgument(sentinelValidTo != null, "sentinelValidTo must be set");
        Preconditions.checkArgument(asOf.isBefore(sentinelValidTo),
                "asOf %s must be before the sentinel %s", asOf, sentinelValidTo);
        for (String column : naturalKey) {
            Preconditions.checkArgument(!systemColumns.contains(column),
                    "natural-key column [%s] collides with a system column", column);
        }
    }
}
