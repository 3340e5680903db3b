package com.raditha.leakage.trace;

/**
 * Derives call stack IDs as a running hash over the calls leading to a stack:
 * {@code id = hash(parentId || source || target)}. The top level has ID 0.
 */
public final class CallStackIds {

    public static final long ROOT = 0L;

    private CallStackIds() {
    }

    public static long derive(long parentCallStackId, long sourceInstructionId, long targetInstructionId) {
        long h = mix(parentCallStackId ^ 0x9E3779B97F4A7C15L);
        h = mix(h ^ sourceInstructionId);
        h = mix(h ^ targetInstructionId);
        // 0 is reserved for the top level
        return h == ROOT ? 1L : h;
    }

    private static long mix(long value) {
        long h = value;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
