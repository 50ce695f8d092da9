package rules.records;

import static rules.constants.RulesConstants.BOARD_SIZE;

import java.util.Objects;

/**
 * A board coordinate.
 *
 * @param x file index, A = 0 … H = 7
 * @param y row index, 0 = rank 8 … 7 = rank 1
 */
public record Coord(int x, int y) {

    private static final Coord[] CACHE = new Coord[BOARD_SIZE * BOARD_SIZE];

    static {
        for (int y = 0; y < BOARD_SIZE; y++)
            for (int x = 0; x < BOARD_SIZE; x++)
                CACHE[y * BOARD_SIZE + x] = new Coord(x, y);
    }

    /** Rejects anything off the 8×8 board. */
    public Coord {
        Objects.checkIndex(x, BOARD_SIZE);
        Objects.checkIndex(y, BOARD_SIZE);
    }

    /** Shared instance for {@code (x, y)}; fails fast off the board. */
    public static Coord of(int x, int y) {
        Objects.checkIndex(x, BOARD_SIZE);
        Objects.checkIndex(y, BOARD_SIZE);
        return CACHE[y * BOARD_SIZE + x];
    }

    public static boolean onBoard(int x, int y) {
        return x >= 0 && x < BOARD_SIZE && y >= 0 && y < BOARD_SIZE;
    }

    /**
     * Parses algebraic notation such as {@code "e4"} (file letter case-insensitive).
     *
     * @throws IllegalArgumentException if the text is not a square name
     */
    public static Coord parse(String algebraic) {
        Objects.requireNonNull(algebraic, "square must not be null");
        if (algebraic.length() != 2) throw new IllegalArgumentException("Bad square: " + algebraic);
        int file = Character.toLowerCase(algebraic.charAt(0)) - 'a';
        int rank = algebraic.charAt(1) - '0';
        if (file < 0 || file >= BOARD_SIZE || rank < 1 || rank > BOARD_SIZE) {
            throw new IllegalArgumentException("Bad square: " + algebraic);
        }
        return of(file, BOARD_SIZE - rank);
    }

    /** Rank number 1‥8 as printed on the board edge. */
    public int rank() {
        return BOARD_SIZE - y;
    }

    public String toAlgebraic() {
        return String.valueOf((char) ('a' + x)) + rank();
    }

    @Override
    public String toString() {
        return toAlgebraic();
    }
}
