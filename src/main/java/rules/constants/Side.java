package rules.constants;

/**
 * Owner of a square. {@link #NONE} is reserved for empty squares.
 */
public enum Side {
    WHITE,
    BLACK,
    NONE;

    public Side opposite() {
        return switch (this) {
            case WHITE -> BLACK;
            case BLACK -> WHITE;
            case NONE -> throw new IllegalArgumentException("NONE has no opposite side");
        };
    }

    /** Index into the per-side tables (king coordinates, castling rights). */
    public int index() {
        if (this == NONE) throw new IllegalArgumentException("NONE has no side index");
        return ordinal();
    }

    /** Row of the side's back rank (row 0 = rank 8). */
    public int homeRow() {
        return this == WHITE ? 7 : 0;
    }

    public int pawnStartRow() {
        return this == WHITE ? 6 : 1;
    }

    public int promotionRow() {
        return this == WHITE ? 0 : 7;
    }

    public char fenChar() {
        return switch (this) {
            case WHITE -> 'w';
            case BLACK -> 'b';
            case NONE -> throw new IllegalArgumentException("NONE is never to move");
        };
    }
}
