package rules.impl;

import static rules.constants.RulesConstants.MAX_RAY;

import rules.constants.Direction;
import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.records.Coord;
import rules.records.Square;
import rules.state.Board;

import java.util.Arrays;
import java.util.function.BooleanSupplier;

/**
 * Ray-casting attack detector.
 *
 * <p>From the target square every one of the sixteen directions is walked outward. The first
 * attacker-side piece decides the ray:
 * <ul>
 *   <li>king and knight only count one step away, along a direction of their own move set</li>
 *   <li>a pawn only counts one step away, on the diagonal its forward capture would use</li>
 *   <li>queen, rook and bishop count at any distance along their own directions</li>
 * </ul>
 * Rays are pure reads of the board and independent of each other, so they may be evaluated in
 * parallel; the answer never depends on the evaluation order.
 */
public final class AttackDetectorImpl implements AttackDetector {

    private static final Direction[] DIRECTIONS = Direction.values();

    private final BooleanSupplier parallel;

    /** Sequential scan. */
    public AttackDetectorImpl() {
        this(() -> false);
    }

    /**
     * @param parallel consulted on every query; {@code true} spreads the rays over the common
     *     fork-join pool
     */
    public AttackDetectorImpl(BooleanSupplier parallel) {
        this.parallel = parallel;
    }

    @Override
    public boolean isAttacked(Board board, Coord square, Side attacker) {
        Side defender = attacker.opposite();
        if (parallel.getAsBoolean()) {
            return Arrays.stream(DIRECTIONS)
                    .parallel()
                    .anyMatch(d -> rayHits(board, square, d, attacker, defender));
        }
        for (Direction d : DIRECTIONS) {
            if (rayHits(board, square, d, attacker, defender)) return true;
        }
        return false;
    }

    private static boolean rayHits(Board board, Coord square, Direction d, Side attacker, Side defender) {
        int x = square.x();
        int y = square.y();
        for (int step = 1; step <= MAX_RAY; step++) {
            x += d.dx();
            y += d.dy();
            if (!Coord.onBoard(x, y)) return false;

            Square sq = board.get(x, y);
            if (sq.color() == defender) return false;

            switch (sq.piece()) {
                case EMPTY -> {
                    continue;
                }
                case KING, KNIGHT -> {
                    return step == 1 && sq.moves().contains(d);
                }
                case PAWN -> {
                    return step == 1 && isPawnCaptureRay(d, attacker);
                }
                case QUEEN, ROOK, BISHOP -> {
                    return sq.moves().contains(d);
                }
            }
        }
        return false;
    }

    /* seen from the target: white pawns sit below it (DL/DR), black pawns above it (UL/UR) */
    private static boolean isPawnCaptureRay(Direction d, Side attacker) {
        return switch (attacker) {
            case WHITE -> d == Direction.DL || d == Direction.DR;
            case BLACK -> d == Direction.UL || d == Direction.UR;
            case NONE -> false;
        };
    }
}
