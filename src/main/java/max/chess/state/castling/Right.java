package max.chess.state.castling;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import max.chess.state.common.BoardSide;
import max.chess.state.common.Color;
import max.chess.state.common.Square;

import java.util.Optional;

/**
 * A single castling right: one color allowed to castle towards one side of the board.
 */
public enum Right {
    WHITE_KINGSIDE, WHITE_QUEENSIDE, BLACK_KINGSIDE, BLACK_QUEENSIDE;

    // Declaration order is also FEN order (K, Q, k, q), CastlingRights relies on it.
    // Kept package-private: an array cannot be made read-only, callers outside use values()
    static final Right[] VALUES = Right.values();

    private static final long BIT_MASK_KING_CASTLE_WHITE_PASSAGE_SQUARES = 0b01100000L;
    private static final long BIT_MASK_QUEEN_CASTLE_WHITE_PASSAGE_SQUARES = 0b00001110L;
    private static final long BIT_MASK_KING_CASTLE_BLACK_PASSAGE_SQUARES = BIT_MASK_KING_CASTLE_WHITE_PASSAGE_SQUARES << 56;
    private static final long BIT_MASK_QUEEN_CASTLE_BLACK_PASSAGE_SQUARES = BIT_MASK_QUEEN_CASTLE_WHITE_PASSAGE_SQUARES << 56;

    private static final IntList WHITE_KING_SIDE_KING_PATH = path(Square.F1, Square.G1);
    private static final IntList WHITE_QUEEN_SIDE_KING_PATH = path(Square.D1, Square.C1);
    private static final IntList BLACK_KING_SIDE_KING_PATH = path(Square.F8, Square.G8);
    private static final IntList BLACK_QUEEN_SIDE_KING_PATH = path(Square.D8, Square.C8);

    /**
     * Builds the right matching a color and a board side. Every combination maps to exactly one right.
     */
    public static Right of(Color color, BoardSide side) {
        return switch (color) {
            case WHITE -> switch (side) {
                case KINGSIDE -> WHITE_KINGSIDE;
                case QUEENSIDE -> WHITE_QUEENSIDE;
            };
            case BLACK -> switch (side) {
                case KINGSIDE -> BLACK_KINGSIDE;
                case QUEENSIDE -> BLACK_QUEENSIDE;
            };
        };
    }

    /**
     * Reads a FEN castling letter.
     *
     * @return the right, or empty if the letter is not one of {@code K}, {@code Q}, {@code k}, {@code q}
     */
    public static Optional<Right> fromCharacter(char character) {
        return switch (character) {
            case 'K' -> Optional.of(WHITE_KINGSIDE);
            case 'Q' -> Optional.of(WHITE_QUEENSIDE);
            case 'k' -> Optional.of(BLACK_KINGSIDE);
            case 'q' -> Optional.of(BLACK_QUEENSIDE);
            default -> Optional.empty();
        };
    }

    public Color color() {
        return switch (this) {
            case WHITE_KINGSIDE, WHITE_QUEENSIDE -> Color.WHITE;
            case BLACK_KINGSIDE, BLACK_QUEENSIDE -> Color.BLACK;
        };
    }

    public BoardSide side() {
        return switch (this) {
            case WHITE_KINGSIDE, BLACK_KINGSIDE -> BoardSide.KINGSIDE;
            case WHITE_QUEENSIDE, BLACK_QUEENSIDE -> BoardSide.QUEENSIDE;
        };
    }

    /**
     * @return the same side of the board for the given color
     */
    public Right withColor(Color color) {
        return of(color, side());
    }

    /**
     * @return the same color castling towards the given side
     */
    public Right withSide(BoardSide side) {
        return of(color(), side);
    }

    /**
     * The squares between king and rook that have to be empty for the castle to be played.
     */
    public long emptySquares() {
        return switch (this) {
            case WHITE_KINGSIDE -> BIT_MASK_KING_CASTLE_WHITE_PASSAGE_SQUARES;
            case WHITE_QUEENSIDE -> BIT_MASK_QUEEN_CASTLE_WHITE_PASSAGE_SQUARES;
            case BLACK_KINGSIDE -> BIT_MASK_KING_CASTLE_BLACK_PASSAGE_SQUARES;
            case BLACK_QUEENSIDE -> BIT_MASK_QUEEN_CASTLE_BLACK_PASSAGE_SQUARES;
        };
    }

    /**
     * Where the king lands once castled.
     */
    public Square castleSquare() {
        return switch (this) {
            case WHITE_KINGSIDE -> Square.G1;
            case WHITE_QUEENSIDE -> Square.C1;
            case BLACK_KINGSIDE -> Square.G8;
            case BLACK_QUEENSIDE -> Square.C8;
        };
    }

    public Square kingSquare() {
        return color().isWhite() ? Square.E1 : Square.E8;
    }

    public Square rookSquare() {
        return switch (this) {
            case WHITE_KINGSIDE -> Square.H1;
            case WHITE_QUEENSIDE -> Square.A1;
            case BLACK_KINGSIDE -> Square.H8;
            case BLACK_QUEENSIDE -> Square.A8;
        };
    }

    // Where the rook lands once castled
    public Square rookCastleSquare() {
        return switch (this) {
            case WHITE_KINGSIDE -> Square.F1;
            case WHITE_QUEENSIDE -> Square.D1;
            case BLACK_KINGSIDE -> Square.F8;
            case BLACK_QUEENSIDE -> Square.D8;
        };
    }

    /**
     * Indices of the squares the king walks through, in walking order, ending on {@link #castleSquare()}. None of
     * them may be attacked. On the queen side this is narrower than {@link #emptySquares()}: the b-file square has
     * to be empty but may be attacked.
     *
     * @return an unmodifiable list of square indices
     */
    public IntList kingPassageSquares() {
        return switch (this) {
            case WHITE_KINGSIDE -> WHITE_KING_SIDE_KING_PATH;
            case WHITE_QUEENSIDE -> WHITE_QUEEN_SIDE_KING_PATH;
            case BLACK_KINGSIDE -> BLACK_KING_SIDE_KING_PATH;
            case BLACK_QUEENSIDE -> BLACK_QUEEN_SIDE_KING_PATH;
        };
    }

    /**
     * The FEN letter, uppercase for white and lowercase for black.
     */
    public char character() {
        return switch (this) {
            case WHITE_KINGSIDE -> 'K';
            case WHITE_QUEENSIDE -> 'Q';
            case BLACK_KINGSIDE -> 'k';
            case BLACK_QUEENSIDE -> 'q';
        };
    }

    int flag() {
        return switch (this) {
            case WHITE_KINGSIDE -> 0b0001;
            case WHITE_QUEENSIDE -> 0b0010;
            case BLACK_KINGSIDE -> 0b0100;
            case BLACK_QUEENSIDE -> 0b1000;
        };
    }

    private static IntList path(Square passage, Square destination) {
        return IntLists.unmodifiable(IntArrayList.wrap(new int[]{passage.index(), destination.index()}));
    }
}
