package io.github.yok.temporalsync.core;

import com.google.common.base.Preconditions;
import io.github.yok.temporalsync.sink.SystemColumns;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Computes the SHA-256 content digest of the payload columns of a row.
 *
 * <p>
 * The digest does not depend on how the row was produced:
 * </p>
 * <ul>
 * <li>columns are visited in lower-cased name order, not in presentation order;</li>
 * <li>system columns and natural-key columns are left out;</li>
 * <li>each value goes through {@link CanonicalValueType} before hashing, and columns whose value
 * canonicalizes to {@code null} contribute nothing;</li>
 * <li>every column contributes its name and a length-framed value, so neighbouring values cannot
 * run into each other.</li>
 * </ul>
 *
 * <p>
 * Two rows of the same natural key with equal digests are treated as identical versions. Digest
 * collisions are not handled.
 * </p>
 */
public class RowHasher {

    private static final byte NAME_TERMINATOR = 0x00;

    /**
     * Computes the digest of a row.
     *
     * @param row column/value mapping (source row or stored version)
     * @param naturalKeyColumns natural-key column names, excluded from the digest
     * @param systemColumns system column names, excluded from the digest
     * @return lower-case hexadecimal SHA-256 digest
     * @throws IllegalArgumentException if a value has an unsupported Java type, or two column
     *         names differ only by case
     */
    public String hash(Map<String, ?> row, List<String> naturalKeyColumns,
            SystemColumns systemColumns) {
        Set<String> keyLower = new HashSet<>();
        for (String column : naturalKeyColumns) {
            keyLower.add(column.toLowerCase(Locale.ROOT));
        }

        TreeMap<String, Object> payload = new TreeMap<>();
        for (Map.Entry<String, ?> entry : row.entrySet()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (systemColumns.contains(name) || keyLower.contains(name)) {
                continue;
            }
            Preconditions.checkArgument(!payload.containsKey(name),
                    "column names differ only by case: %s", row.keySet());
            payload.put(name, entry.getValue());
        }

        MessageDigest digest = DigestUtils.getSha256Digest();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            byte[] value = CanonicalValueType.canonicalBytes(entry.getValue());
            // an absent column and a null column hash the same
            if (value == null) {
                continue;
            }
            DigestUtils.updateDigest(digest, entry.getKey().getBytes(StandardCharsets.UTF_8));
            digest.update(NAME_TERMINATOR);
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(value.length).array());
            digest.update(value);
        }
        return Hex.encodeHexString(digest.digest());
    }
}
