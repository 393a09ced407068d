package max.chess.state.utils;

public final class BitUtils {

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the flags provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param flags the flags for which the LS1B is to be returned
     * @return the index of the first bit set to 1, or 32 if none is set
     */
    public static int bitScanForward(int flags) {
        return Integer.numberOfTrailingZeros(flags);
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    // Pops the LS1B, handy when walking flags one by one
    public static int clearLowestBit(int flags) {
        return flags & (flags - 1);
    }

    public static int bitCount(int flags) {
        return Integer.bitCount(flags);
    }

    private BitUtils() {}
}
