package rules.contracts;

import rules.constants.PieceKind;
import rules.records.Coord;
import rules.records.MoveOutcome;
import rules.state.GameState;

import java.util.Optional;

public interface MoveMaker {

    /**
     * Applies an already validated legal move to {@code state} in place.
     *
     * <p>If a pawn reaches the last rank and {@code promotion} is empty, the outcome reports a
     * pending promotion and the turn does not advance until {@link #completePromotion} is called.
     */
    MoveOutcome make(GameState state, Coord from, Coord to, Optional<PieceKind> promotion);

    /**
     * Places the chosen piece on the pending promotion square and finishes the move.
     *
     * @throws IllegalArgumentException if {@code choice} is not a queen, rook, bishop or knight
     */
    MoveOutcome completePromotion(GameState state, PieceKind choice);
}
