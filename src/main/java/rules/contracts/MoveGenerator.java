package rules.contracts;

import rules.constants.Side;
import rules.records.Coord;
import rules.state.GameState;

import java.util.Set;

public interface MoveGenerator {

    /**
     * Legal destinations of the piece on {@code from}, for that piece's own side. An empty
     * square yields an empty set. The state is mutated during legality simulation and restored
     * before the method returns.
     */
    Set<Coord> generateMoves(GameState state, Coord from);

    /** Whether {@code side}'s king currently stands attacked. */
    boolean isInCheck(GameState state, Side side);
}
