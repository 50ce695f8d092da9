package rules.impl;

import static rules.constants.RulesConstants.*;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.constants.Terminal;
import rules.contracts.MoveGenerator;
import rules.contracts.MoveMaker;
import rules.contracts.TerminalDetector;
import rules.exceptions.IllegalSelectionException;
import rules.records.Coord;
import rules.records.MoveOutcome;
import rules.records.Square;
import rules.state.Board;
import rules.state.GameState;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a legal move to the game state.
 *
 * <p>The bookkeeping runs in a fixed order, each step reading the pre-move origin and
 * destination squares: halfmove clock, en-passant capture, en-passant target, castling rights,
 * castle rook relocation, king coordinate, board, promotion, turn, check flag, terminal state.
 */
public final class MoveMakerImpl implements MoveMaker {

    private static final Logger LOG = LoggerFactory.getLogger(MoveMakerImpl.class);

    private final MoveGenerator generator;
    private final TerminalDetector terminal;

    public MoveMakerImpl(MoveGenerator generator, TerminalDetector terminal) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    @Override
    public MoveOutcome make(GameState state, Coord from, Coord to, Optional<PieceKind> promotion) {
        promotion.ifPresent(MoveMakerImpl::requirePromotionChoice);

        Board board = state.board();
        Square moving = board.get(from);
        Square target = board.get(to);
        Side side = moving.color();
        PieceKind kind = moving.piece();

        /* 1) halfmove clock */
        if (kind == PieceKind.PAWN || !target.isEmpty()) state.setHalfmoveClock(0);
        else state.setHalfmoveClock(state.halfmoveClock() + 1);

        /* 2) en-passant capture */
        Coord victim = state.enPassantVictim(from, to);
        if (victim != null) board.clear(victim);

        /* 3) en-passant target */
        state.setEnPassantTarget(null);
        if (kind == PieceKind.PAWN && Math.abs(to.y() - from.y()) == 2) {
            state.setEnPassantTarget(Coord.of(from.x(), (from.y() + to.y()) / 2));
        }

        /* 4) castling rights */
        updateCastlingRights(state, from, moving, to, target);

        /* 5) rook hop */
        if (kind == PieceKind.KING && Math.abs(to.x() - from.x()) == 2) {
            boolean kingside = to.x() > from.x();
            Coord rookFrom = Coord.of(kingside ? KINGSIDE_ROOK_FILE : QUEENSIDE_ROOK_FILE, to.y());
            Coord rookTo = Coord.of(kingside ? to.x() - 1 : to.x() + 1, to.y());
            board.set(rookTo, board.get(rookFrom));
            board.clear(rookFrom);
        }

        /* 6) king coordinate */
        if (kind == PieceKind.KING) state.setKingCoord(side, to);

        /* 7) board */
        board.set(to, moving);
        board.clear(from);

        LOG.debug("{} {} {}-{}", side, kind, from, to);

        /* 8) promotion */
        if (kind == PieceKind.PAWN && to.y() == side.promotionRow()) {
            if (promotion.isEmpty()) {
                state.setPendingPromotion(to);
                LOG.debug("{} pawn on {} awaits promotion", side, to);
                return MoveOutcome.awaitingPromotion();
            }
            board.set(to, Square.of(promotion.get(), side));
        }

        return finishTurn(state);
    }

    @Override
    public MoveOutcome completePromotion(GameState state, PieceKind choice) {
        requirePromotionChoice(choice);
        Coord square = state.pendingPromotion();
        if (square == null) throw new IllegalSelectionException("no promotion is pending");

        Side side = state.board().get(square).color();
        state.board().set(square, Square.of(choice, side));
        state.setPendingPromotion(null);
        LOG.debug("{} pawn on {} promoted to {}", side, square, choice);
        return finishTurn(state);
    }

    /* steps 9 – 11 */
    private MoveOutcome finishTurn(GameState state) {
        if (state.turn() == Side.BLACK) state.setFullmoveNumber(state.fullmoveNumber() + 1);
        state.setTurn(state.turn().opposite());

        boolean check = generator.isInCheck(state, state.turn());
        state.setCheck(check);

        Terminal result = terminal.classify(state);
        state.setTerminal(result);
        if (result != Terminal.NONE) LOG.debug("{} with {} to move", result, state.turn());

        return new MoveOutcome(check, result, false);
    }

    /**
     * A king move drops both rights of its side; a rook leaving its corner drops that wing. A
     * capture on the opponent's rook corner drops the opponent's right for that wing.
     */
    private static void updateCastlingRights(GameState state, Coord from, Square moving, Coord to, Square target) {
        Side side = moving.color();
        if (moving.piece() == PieceKind.KING) {
            state.clearCastlingRights(side);
        } else if (moving.piece() == PieceKind.ROOK) {
            dropRightForCorner(state, side, from);
        }
        if (target.piece() == PieceKind.ROOK) {
            dropRightForCorner(state, target.color(), to);
        }
    }

    static void dropRightForCorner(GameState state, Side side, Coord square) {
        if (square.y() != side.homeRow()) return;
        if (square.x() == KINGSIDE_ROOK_FILE) state.setCastlingRight(side, KINGSIDE, false);
        else if (square.x() == QUEENSIDE_ROOK_FILE) state.setCastlingRight(side, QUEENSIDE, false);
    }

    private static void requirePromotionChoice(PieceKind kind) {
        if (!kind.isPromotionChoice()) {
            throw new IllegalArgumentException("cannot promote to " + kind);
        }
    }
}
