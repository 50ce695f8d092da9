package rules.constants;

import rules.records.Coord;

import java.util.Optional;

/**
 * The sixteen step vectors every movement and attack query walks along.
 *
 * <p>Offsets are expressed in board coordinates: {@code dx} grows toward the H-file and
 * {@code dy} grows toward rank 1, so {@link #U} points at Black's back rank.
 */
public enum Direction {
    /* ────── orthogonal ────── */
    U(0, -1),
    D(0, 1),
    R(1, 0),
    L(-1, 0),

    /* ────── diagonal ────── */
    UL(-1, -1),
    DL(-1, 1),
    UR(1, -1),
    DR(1, 1),

    /* ────── knight ────── */
    RRU(2, -1),
    RUU(1, -2),
    RRD(2, 1),
    RDD(1, 2),
    LUU(-1, -2),
    LLU(-2, -1),
    LLD(-2, 1),
    LDD(-1, 2);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /** The vector pointing the other way along the same line. */
    public Direction opposite() {
        return switch (this) {
            case U -> D;
            case D -> U;
            case R -> L;
            case L -> R;
            case UL -> DR;
            case DR -> UL;
            case UR -> DL;
            case DL -> UR;
            case RRU -> LLD;
            case LLD -> RRU;
            case RUU -> LDD;
            case LDD -> RUU;
            case RRD -> LLU;
            case LLU -> RRD;
            case RDD -> LUU;
            case LUU -> RDD;
        };
    }

    public boolean isOrthogonal() {
        return (dx == 0) != (dy == 0);
    }

    public boolean isDiagonal() {
        return Math.abs(dx) == 1 && Math.abs(dy) == 1;
    }

    public boolean isKnightJump() {
        return Math.abs(dx) + Math.abs(dy) == 3;
    }

    /**
     * Unit direction leading from {@code from} to {@code to} when both share a rank, file or
     * diagonal.
     *
     * @return the direction, or empty when the squares coincide or are not aligned
     */
    public static Optional<Direction> between(Coord from, Coord to) {
        int ddx = to.x() - from.x();
        int ddy = to.y() - from.y();
        if (ddx == 0 && ddy == 0) return Optional.empty();
        if (ddx != 0 && ddy != 0 && Math.abs(ddx) != Math.abs(ddy)) return Optional.empty();

        int sx = Integer.signum(ddx);
        int sy = Integer.signum(ddy);
        for (Direction d : values()) {
            if (d.dx == sx && d.dy == sy) return Optional.of(d);
        }
        return Optional.empty();
    }
}
