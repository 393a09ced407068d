package max.chess.state.common;

// Side of the board a king castles towards
public enum BoardSide {
    KINGSIDE, QUEENSIDE
}
