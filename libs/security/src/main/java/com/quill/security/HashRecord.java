package com.quill.security;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A stored password credential in modular-crypt BCrypt form.
 * <p>
 * The encoded string embeds the algorithm version, the cost factor and the salt
 * ({@code $2a$<cost>$<salt><digest>}), so a record can always be verified with the parameters it
 * was created under, whatever the hasher's current configuration.
 *
 * @param encoded the full encoded hash as produced by {@link PasswordHasher#hash(String)}
 */
public record HashRecord(String encoded) {

    private static final Pattern BCRYPT_PREFIX = Pattern.compile("^\\$2[aby]?\\$(\\d\\d)\\$");

    public HashRecord {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("encoded hash must not be null or blank");
        }
    }

    /**
     * Returns the cost factor stored in this record, or {@code -1} when the record is not in
     * BCrypt form.
     */
    public int cost() {
        Matcher matcher = BCRYPT_PREFIX.matcher(encoded);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : -1;
    }

    @Override
    public String toString() {
        return "HashRecord[cost=" + cost() + "]";
    }
}
