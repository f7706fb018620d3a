package com.vortex.runtime;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1a hash of a stream's label string.
 *
 * <p>Stable across processes and JVM versions, unlike {@link String#hashCode()}
 * widened to a long.
 */
public final class StreamHash {

    private static final long FNV64_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV64_PRIME = 0x100000001b3L;

    private StreamHash() {} // Utility class

    /**
     * Hashes a label string.
     *
     * @param labels the canonical label string
     * @return the hash; compare with {@link Long#compareUnsigned} when ordering
     */
    public static long of(String labels) {
        long hash = FNV64_OFFSET_BASIS;
        for (byte b : labels.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV64_PRIME;
        }
        return hash;
    }
}
