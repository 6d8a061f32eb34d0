package com.dataflow.sdg.util;

import java.nio.charset.StandardCharsets;

/**
 * Stable hash helpers used for level identities.
 *
 * <p>
 * The values must not depend on object identity or JVM run, so strings are
 * hashed over their UTF-8 bytes (64-bit FNV-1a) and combined with a
 * boost-style mixing step.
 */
public final class Hashing {
    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private Hashing() {
        // Utility class
    }

    public static long hash(String str) {
        long h = FNV_OFFSET;
        for (byte b : str.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        return h;
    }

    public static long hash(long i) {
        long z = i + 0x9e3779b97f4a7c15L;
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }

    public static long hash(long i, long j) {
        return i ^ (hash(j) + 0x9e3779b97f4a7c15L + (i << 6) + (i >>> 2));
    }

    public static long hash(long i, String str) {
        return hash(i, hash(str));
    }

    public static long hash(long i, long j, long... ks) {
        long h = hash(i, j);
        for (long k : ks)
            h = hash(h, k);
        return h;
    }
}
