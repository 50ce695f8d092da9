package rules.contracts;

import rules.constants.Side;
import rules.records.Coord;
import rules.records.PinAxis;
import rules.state.GameState;

import java.util.Optional;

public interface PinDetector {

    /**
     * Finds the line a piece of {@code side} standing on {@code pieceSquare} is pinned to.
     *
     * @return the pin axis, or empty when moving the piece cannot expose its king along a line
     */
    Optional<PinAxis> checkForPin(GameState state, Coord pieceSquare, Side side);
}
