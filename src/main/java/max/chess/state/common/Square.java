package max.chess.state.common;

import max.chess.state.utils.BitUtils;

import java.util.Optional;

/**
 * A square of the board. Declaration order follows the bitboard convention used across the engine: index 0 is a1,
 * index 7 is h1, index 56 is a8 and index 63 is h8.
 */
public enum Square {
    A1, B1, C1, D1, E1, F1, G1, H1,
    A2, B2, C2, D2, E2, F2, G2, H2,
    A3, B3, C3, D3, E3, F3, G3, H3,
    A4, B4, C4, D4, E4, F4, G4, H4,
    A5, B5, C5, D5, E5, F5, G5, H5,
    A6, B6, C6, D6, E6, F6, G6, H6,
    A7, B7, C7, D7, E7, F7, G7, H7,
    A8, B8, C8, D8, E8, F8, G8, H8;

    private static final Square[] VALUES = Square.values();

    public static Square of(int index) {
        if(index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Square index out of board: " + index);
        }
        return VALUES[index];
    }

    public static Square of(int file, int rank) {
        if(file < 0 || file > 7 || rank < 0 || rank > 7) {
            throw new IllegalArgumentException("Square out of board: file=" + file + ", rank=" + rank);
        }
        return VALUES[file + 8 * rank];
    }

    /**
     * Reads a square in algebraic notation such as {@code "e1"}.
     *
     * @return the square, or empty if the text is not a square of the board
     */
    public static Optional<Square> fromAlgebraic(String algebraic) {
        if(algebraic == null || algebraic.length() != 2) {
            return Optional.empty();
        }
        int file = algebraic.charAt(0) - 'a';
        int rank = algebraic.charAt(1) - '1';
        if(file < 0 || file > 7 || rank < 0 || rank > 7) {
            return Optional.empty();
        }
        return Optional.of(of(file, rank));
    }

    public int index() {
        return ordinal();
    }

    // 0 for the a-file, 7 for the h-file
    public int file() {
        return ordinal() % 8;
    }

    // 0 for the 1st rank, 7 for the 8th rank
    public int rank() {
        return ordinal() / 8;
    }

    public long bitboard() {
        return BitUtils.getPositionIndexBitMask(ordinal());
    }

    public String toAlgebraic() {
        return String.valueOf((char) ('a' + file())) + (char) ('1' + rank());
    }
}
