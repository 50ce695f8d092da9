package rules.contracts;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.records.Coord;
import rules.records.MoveOutcome;
import rules.records.Square;
import rules.state.GameState;

import java.util.Optional;
import java.util.Set;

/**
 * The surface a front-end drives: query legal moves, apply moves, read check status, move
 * positions in and out as FEN, and edit the board directly.
 */
public interface RulesEngine {

    /**
     * @throws rules.exceptions.IllegalSelectionException if the square is empty, belongs to the
     *     side not to move, or a promotion is pending
     */
    Set<Coord> legalMoves(Coord square);

    /**
     * @throws rules.exceptions.IllegalSelectionException if {@code to} is not a legal destination
     *     of the piece on {@code from}
     */
    MoveOutcome applyMove(Coord from, Coord to, Optional<PieceKind> promotion);

    /** Finishes a move that stopped on the last rank. */
    MoveOutcome completePromotion(PieceKind choice);

    boolean isInCheck(Side side);

    String toFen();

    /**
     * Replaces the current game with the decoded one. On failure the current game is kept.
     *
     * @return a copy of the decoded state
     * @throws rules.exceptions.MalformedFenException if the text is not valid FEN
     */
    GameState fromFen(String fen);

    /** Puts a piece on a square, bypassing move legality. */
    void placePiece(PieceKind kind, Side color, Coord square);

    void clearSquare(Coord square);

    void clearBoard();

    /** Back to the starting position. */
    void reset();

    Square pieceAt(Coord square);

    Side sideToMove();

    /** A detached copy of the current state. */
    GameState state();
}
