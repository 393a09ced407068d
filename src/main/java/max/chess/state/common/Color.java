package max.chess.state.common;

import java.util.Optional;

/**
 * The color of a piece, or of the side to move.
 */
public enum Color {
    WHITE, BLACK;

    public boolean isWhite() {
        return this == WHITE;
    }

    public boolean isBlack() {
        return this == BLACK;
    }

    /**
     * @return the FEN side-to-move letter, {@code 'w'} for white and {@code 'b'} for black
     */
    public char character() {
        return isWhite() ? 'w' : 'b';
    }

    /**
     * Returns the opposite color. Colors are immutable, so inverting a color held in a variable is
     * {@code color = color.inverse()}.
     */
    public Color inverse() {
        return switch (this) {
            case WHITE -> BLACK;
            case BLACK -> WHITE;
        };
    }

    /**
     * Reads a color letter of any case.
     *
     * @return the color, or empty if the letter is neither {@code w} nor {@code b}
     */
    public static Optional<Color> fromCharacter(char character) {
        return switch (character) {
            case 'W', 'w' -> Optional.of(WHITE);
            case 'B', 'b' -> Optional.of(BLACK);
            default -> Optional.empty();
        };
    }
}
