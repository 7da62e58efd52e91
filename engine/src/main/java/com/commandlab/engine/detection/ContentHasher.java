package com.commandlab.engine.detection;

import java.nio.charset.StandardCharsets;

/**
 * Content fingerprints for change detection.
 *
 * 64-bit FNV-1a over the UTF-8 bytes, rendered as 16 hex digits. Not
 * collision-resistant against crafted input; only used to tell whether a
 * text changed between two snapshots.
 */
public final class ContentHasher {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME  = 0x100000001b3L;

    private ContentHasher() {}

    public static String hash(String text) {
        long h = FNV_OFFSET;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        return String.format("%016x", h);
    }

    /** Number of '\n'-separated segments; an empty text counts as one line. */
    public static int lineCount(String text) {
        return text.split("\n", -1).length;
    }
}
