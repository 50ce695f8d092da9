package rules.records;

import rules.constants.Terminal;

/**
 * Result of applying a move.
 *
 * @param check            the side now to move is in check
 * @param terminal         checkmate, stalemate or {@link Terminal#NONE}
 * @param pendingPromotion a pawn reached the last rank and waits for a piece choice; the turn
 *                         has not advanced yet
 */
public record MoveOutcome(boolean check, Terminal terminal, boolean pendingPromotion) {

    public static MoveOutcome awaitingPromotion() {
        return new MoveOutcome(false, Terminal.NONE, true);
    }
}
