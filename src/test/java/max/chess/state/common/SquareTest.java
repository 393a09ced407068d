package max.chess.state.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SquareTest {

    @Test
    public void indicesShouldFollowBitboardConvention() {
        assertEquals(0, Square.A1.index());
        assertEquals(7, Square.H1.index());
        assertEquals(56, Square.A8.index());
        assertEquals(63, Square.H8.index());
        assertEquals(1L << 6, Square.G1.bitboard());
        assertEquals(1L << 63, Square.H8.bitboard());
    }

    @Test
    public void fileAndRankShouldBeZeroBased() {
        // Given
        Square square = Square.C8;

        // then
        assertEquals(2, square.file());
        assertEquals(7, square.rank());
        assertEquals(square, Square.of(2, 7));
    }

    @ParameterizedTest
    @EnumSource(Square.class)
    public void algebraicNotationShouldBeReadBack(Square square) {
        // When
        String algebraic = square.toAlgebraic();

        // then
        assertEquals(Optional.of(square), Square.fromAlgebraic(algebraic));
        assertEquals(square, Square.of(square.index()));
    }

    @Test
    public void toAlgebraicShouldUseLowercaseFile() {
        assertEquals("e1", Square.E1.toAlgebraic());
        assertEquals("g8", Square.G8.toAlgebraic());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "e", "e9", "i1", "E1", "e10", "a0"})
    public void fromAlgebraicShouldRejectUnknownSquares(String algebraic) {
        assertTrue(Square.fromAlgebraic(algebraic).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 64})
    public void ofShouldRejectIndicesOutOfBoard(int index) {
        assertThrows(IllegalArgumentException.class, () -> Square.of(index));
    }
}
