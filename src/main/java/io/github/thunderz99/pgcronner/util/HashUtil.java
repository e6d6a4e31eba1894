package io.github.thunderz99.pgcronner.util;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A util for string hashing
 */
public class HashUtil {


    private static final HashFunction murmurHash3_128 = Hashing.murmur3_128();

    HashUtil() {
    }

    /**
     * Convert string to a 64-bit key, usable as a postgres advisory lock key (pg_advisory_lock takes a bigint).
     *
     * @param origin
     * @return first 64 bits of the MurmurHash3 hash
     */
    public static long toLongKey(String origin) {
        return murmurHash3_128.hashString(origin, StandardCharsets.UTF_8).asLong();
    }

}
