package rules.state;

import static rules.constants.RulesConstants.BOARD_SIZE;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.records.Coord;
import rules.records.Square;

import java.util.Arrays;
import java.util.Objects;

/**
 * The 8×8 grid, row-major, row 0 = rank 8 (Black's back rank) through row 7 = rank 1.
 *
 * <p>Out-of-range indices are programming errors and surface as
 * {@link IndexOutOfBoundsException}.
 */
public final class Board {

    private static final PieceKind[] BACK_RANK = {
            PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
            PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    private final Square[][] grid = new Square[BOARD_SIZE][BOARD_SIZE];

    /** An empty board. */
    public Board() {
        clearAll();
    }

    /** The orthodox starting arrangement. */
    public static Board standard() {
        Board b = new Board();
        for (int x = 0; x < BOARD_SIZE; x++) {
            b.grid[0][x] = Square.of(BACK_RANK[x], Side.BLACK);
            b.grid[1][x] = Square.of(PieceKind.PAWN, Side.BLACK);
            b.grid[6][x] = Square.of(PieceKind.PAWN, Side.WHITE);
            b.grid[7][x] = Square.of(BACK_RANK[x], Side.WHITE);
        }
        return b;
    }

    public Board copy() {
        Board b = new Board();
        for (int y = 0; y < BOARD_SIZE; y++) System.arraycopy(grid[y], 0, b.grid[y], 0, BOARD_SIZE);
        return b;
    }

    public Square get(int x, int y) {
        return grid[y][x];
    }

    public Square get(Coord c) {
        return grid[c.y()][c.x()];
    }

    public void set(Coord c, Square square) {
        grid[c.y()][c.x()] = Objects.requireNonNull(square, "square");
    }

    public void clear(Coord c) {
        grid[c.y()][c.x()] = Square.EMPTY;
    }

    public void clearAll() {
        for (Square[] row : grid) Arrays.fill(row, Square.EMPTY);
    }

    /** Plain-text diagram, rank 8 first, upper case = White, {@code .} = empty. */
    public String toDiagram() {
        StringBuilder sb = new StringBuilder(BOARD_SIZE * 20);
        for (int y = 0; y < BOARD_SIZE; y++) {
            sb.append(BOARD_SIZE - y).append(' ');
            for (int x = 0; x < BOARD_SIZE; x++) {
                Square sq = grid[y][x];
                sb.append(sq.isEmpty() ? '.' : sq.fenLetter());
                if (x < BOARD_SIZE - 1) sb.append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g h");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.deepEquals(grid, other.grid);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(grid);
    }

    @Override
    public String toString() {
        return toDiagram();
    }
}
