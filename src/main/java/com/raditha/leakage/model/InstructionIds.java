package com.raditha.leakage.model;

/**
 * Instruction and address IDs are opaque 64-bit values. Tracers usually encode
 * them as {@code (imageId << 32) | relativeOffset}; these helpers build and
 * render that encoding without resolving any symbols.
 */
public final class InstructionIds {

    private InstructionIds() {
    }

    public static long of(int imageId, long offset) {
        return ((long) imageId << 32) | (offset & 0xFFFF_FFFFL);
    }

    public static int imageId(long instructionId) {
        return (int) (instructionId >>> 32);
    }

    public static long offset(long instructionId) {
        return instructionId & 0xFFFF_FFFFL;
    }

    /**
     * Formats as {@code image+offset}, e.g. {@code 2+1a3f}.
     */
    public static String format(long instructionId) {
        return imageId(instructionId) + "+" + Long.toHexString(offset(instructionId));
    }
}
