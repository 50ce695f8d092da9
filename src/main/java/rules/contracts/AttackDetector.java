package rules.contracts;

import rules.constants.Side;
import rules.records.Coord;
import rules.state.Board;

public interface AttackDetector {

    /**
     * Whether any piece of {@code attacker} threatens {@code square}. Rays stop at the first
     * piece of the defending side, which shields everything behind it.
     */
    boolean isAttacked(Board board, Coord square, Side attacker);
}
