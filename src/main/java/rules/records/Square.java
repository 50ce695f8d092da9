package rules.records;

import rules.constants.Direction;
import rules.constants.PieceKind;
import rules.constants.Side;

import java.util.Objects;
import java.util.Set;

/** Contents of one board cell. A square is empty iff it belongs to {@link Side#NONE}. */
public record Square(PieceKind piece, Side color) {

    public static final Square EMPTY = new Square(PieceKind.EMPTY, Side.NONE);

    public Square {
        Objects.requireNonNull(piece, "piece must not be null");
        Objects.requireNonNull(color, "color must not be null");
        if ((color == Side.NONE) != (piece == PieceKind.EMPTY)) {
            throw new IllegalArgumentException(piece + " cannot have color " + color);
        }
    }

    public static Square of(PieceKind piece, Side color) {
        return piece == PieceKind.EMPTY ? EMPTY : new Square(piece, color);
    }

    /** Directions this piece may step along; empty for an empty square. */
    public Set<Direction> moves() {
        return piece.moveSet(color);
    }

    public boolean isEmpty() {
        return piece == PieceKind.EMPTY;
    }

    public boolean is(PieceKind kind, Side side) {
        return piece == kind && color == side;
    }

    /** FEN letter: upper case for White, lower case for Black. */
    public char fenLetter() {
        char c = piece.fenLetter();
        return color == Side.WHITE ? Character.toUpperCase(c) : c;
    }
}
