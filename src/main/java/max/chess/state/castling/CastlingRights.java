package max.chess.state.castling;

import max.chess.state.common.BoardSide;
import max.chess.state.common.Color;
import max.chess.state.common.Square;
import max.chess.state.utils.BitUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * The castling rights still available in a position, as found in the third field of a FEN record.
 * <p>
 * Rights are packed in 4 bits, one per {@link Right}. Set operations come in two flavours: {@code union},
 * {@code intersect} and {@code exclusiveOr} return a new instance, while their {@code InPlace} counterparts,
 * {@link #insert(Right)} and {@link #remove(Right)} modify this one. Instances are not thread safe, each position
 * should own its copy (see {@link #copy()}).
 */
public final class CastlingRights implements Iterable<Right> {
    private static final Logger LOG = LoggerFactory.getLogger(CastlingRights.class);

    private static final int NO_RIGHTS = 0;
    private static final int ALL_RIGHTS = 0b1111;
    private static final String NO_RIGHTS_FEN = "-";

    private int bits;

    /**
     * Creates empty rights.
     */
    public CastlingRights() {
        this(NO_RIGHTS);
    }

    private CastlingRights(int bits) {
        this.bits = bits;
    }

    public static CastlingRights none() {
        return new CastlingRights();
    }

    /**
     * Both colors may castle on both sides, as in the standard starting position.
     */
    public static CastlingRights all() {
        return new CastlingRights(ALL_RIGHTS);
    }

    public static CastlingRights of(Right... rights) {
        CastlingRights castlingRights = new CastlingRights();
        for(Right right : rights) {
            castlingRights.insert(right);
        }
        return castlingRights;
    }

    public static CastlingRights copyOf(Iterable<Right> rights) {
        if(rights instanceof CastlingRights) {
            return ((CastlingRights) rights).copy();
        }
        CastlingRights castlingRights = new CastlingRights();
        for(Right right : rights) {
            castlingRights.insert(right);
        }
        return castlingRights;
    }

    /**
     * Rebuilds rights from their packed form, see {@link #bits()}.
     *
     * @throws IllegalArgumentException if {@code bits} uses more than the 4 lowest bits
     */
    public static CastlingRights fromBits(int bits) {
        if((bits & ~ALL_RIGHTS) != 0) {
            throw new IllegalArgumentException("Unexpected castling rights bits: " + Integer.toBinaryString(bits));
        }
        return new CastlingRights(bits);
    }

    /**
     * Reads a FEN castling field: {@code "-"} or any combination of {@code K}, {@code Q}, {@code k} and {@code q}.
     * A single unexpected character rejects the whole field. Repeated letters are accepted.
     *
     * @return the rights, or empty if the field is empty or malformed
     */
    public static Optional<CastlingRights> fromString(String fen) {
        if(fen == null || fen.isEmpty()) {
            LOG.debug("Rejected castling field: empty");
            return Optional.empty();
        }
        if(NO_RIGHTS_FEN.equals(fen)) {
            return Optional.of(new CastlingRights());
        }

        CastlingRights castlingRights = new CastlingRights();
        for(char character : fen.toCharArray()) {
            Optional<Right> right = Right.fromCharacter(character);
            if(right.isEmpty()) {
                LOG.debug("Rejected castling field '{}': unexpected character '{}'", fen, character);
                return Optional.empty();
            }
            castlingRights.insert(right.get());
        }
        return Optional.of(castlingRights);
    }

    public CastlingRights copy() {
        return new CastlingRights(bits);
    }

    /**
     * The packed form of these rights, bit {@code n} standing for {@code Right.VALUES[n]}. Fits in 4 bits.
     */
    public int bits() {
        return bits;
    }

    public boolean isEmpty() {
        return bits == NO_RIGHTS;
    }

    public int size() {
        return BitUtils.bitCount(bits);
    }

    public boolean contains(Right right) {
        return (bits & right.flag()) != 0;
    }

    // Whether the color still has at least one side to castle on
    public boolean canCastle(Color color) {
        return (bits & colorMask(color)) != 0;
    }

    public CastlingRights union(CastlingRights other) {
        return new CastlingRights(bits | other.bits);
    }

    public CastlingRights intersect(CastlingRights other) {
        return new CastlingRights(bits & other.bits);
    }

    public CastlingRights exclusiveOr(CastlingRights other) {
        return new CastlingRights(bits ^ other.bits);
    }

    public void unionInPlace(CastlingRights other) {
        bits |= other.bits;
    }

    public void intersectInPlace(CastlingRights other) {
        bits &= other.bits;
    }

    public void exclusiveOrInPlace(CastlingRights other) {
        bits ^= other.bits;
    }

    /**
     * Adds the right if it is not already there.
     *
     * @return true if the right was added, false if it was already there
     */
    public boolean insert(Right right) {
        int flag = right.flag();
        boolean added = (bits & flag) == 0;
        bits |= flag;
        return added;
    }

    /**
     * Removes the right. Whatever the outcome, {@code contains(right)} is false afterwards.
     *
     * @return the removed right, or empty if it was not there
     */
    public Optional<Right> remove(Right right) {
        int flag = right.flag();
        if((bits & flag) == 0) {
            return Optional.empty();
        }
        bits &= ~flag;
        return Optional.of(right);
    }

    /**
     * Removes both rights of a color, once its king has moved or castled.
     *
     * @return true if at least one right was removed
     */
    public boolean removeAll(Color color) {
        int previousBits = bits;
        bits &= ~colorMask(color);
        return bits != previousBits;
    }

    /**
     * Removes the rights a move from or to {@code square} cancels: a rook leaving or being captured on its original
     * square, or a king leaving its original square. Any other square leaves the rights untouched.
     *
     * @return true if at least one right was removed
     */
    public boolean removeAffectedBy(Square square) {
        int previousBits = bits;
        for(Right right : Right.VALUES) {
            if(right.rookSquare() == square || right.kingSquare() == square) {
                bits &= ~right.flag();
            }
        }
        return bits != previousBits;
    }

    /**
     * Iterates over the rights held when the iterator is created, in FEN order. Later changes to this instance are
     * not seen by the iterator.
     */
    @Override
    public Iterator<Right> iterator() {
        return new RightIterator(bits);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        return bits == ((CastlingRights) o).bits;
    }

    // OR of the members' flags, so only 16 values. Always equal to bits
    @Override
    public int hashCode() {
        int hash = 0;
        for(Right right : this) {
            hash |= right.flag();
        }
        return hash;
    }

    /**
     * @return the FEN castling field, {@code "-"} when no right is left
     */
    @Override
    public String toString() {
        if(isEmpty()) {
            return NO_RIGHTS_FEN;
        }
        // Iteration order is K, Q, k, q which is already sorted by character code
        StringBuilder fen = new StringBuilder(4);
        for(Right right : this) {
            fen.append(right.character());
        }
        return fen.toString();
    }

    private static int colorMask(Color color) {
        Objects.requireNonNull(color, "color");
        return Right.of(color, BoardSide.KINGSIDE).flag() | Right.of(color, BoardSide.QUEENSIDE).flag();
    }

    private static final class RightIterator implements Iterator<Right> {
        private int remaining;

        private RightIterator(int bits) {
            this.remaining = bits;
        }

        @Override
        public boolean hasNext() {
            return remaining != 0;
        }

        @Override
        public Right next() {
            if(remaining == 0) {
                throw new NoSuchElementException();
            }
            int index = BitUtils.bitScanForward(remaining);
            remaining = BitUtils.clearLowestBit(remaining);
            return Right.VALUES[index];
        }
    }
}
