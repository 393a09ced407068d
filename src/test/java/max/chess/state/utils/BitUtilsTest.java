package max.chess.state.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BitUtilsTest {

    @Test
    public void clearLowestBitShouldWalkEverySetFlag() {
        // Given
        int flags = 0b1010;

        // When
        int first = BitUtils.bitScanForward(flags);
        flags = BitUtils.clearLowestBit(flags);
        int second = BitUtils.bitScanForward(flags);
        flags = BitUtils.clearLowestBit(flags);

        // then
        assertEquals(1, first);
        assertEquals(3, second);
        assertEquals(0, flags);
    }

    @Test
    public void bitCountShouldCountSetFlags() {
        assertEquals(0, BitUtils.bitCount(0));
        assertEquals(2, BitUtils.bitCount(0b1100));
        assertEquals(4, BitUtils.bitCount(0b1111));
    }

    @Test
    public void positionIndexBitMaskShouldSetASingleBit() {
        assertEquals(1L, BitUtils.getPositionIndexBitMask(0));
        assertEquals(1L << 63, BitUtils.getPositionIndexBitMask(63));
    }
}
