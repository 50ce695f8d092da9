package rules.impl;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.contracts.*;
import rules.exceptions.IllegalSelectionException;
import rules.exceptions.MalformedFenException;
import rules.records.Coord;
import rules.records.MoveOutcome;
import rules.records.Square;
import rules.state.GameState;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single {@link GameState} and wires the rule components around it. Not thread-safe:
 * the state has exactly one owner and every call runs to completion before returning.
 */
public final class RulesEngineImpl implements RulesEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RulesEngineImpl.class);

    /* ── components ────────────────────────────────────────────── */
    private final MoveGenerator generator;
    private final TerminalDetector terminal;
    private final MoveMaker maker;
    private final FenCodec fen;

    /* ── the game ─────────────────────────────────────────────── */
    private GameState state;

    public RulesEngineImpl() {
        this(new RulesOptionsImpl());
    }

    public RulesEngineImpl(RulesOptions options) {
        this(options, GameState.standard());
    }

    public RulesEngineImpl(RulesOptions options, GameState initial) {
        Objects.requireNonNull(options, "options");
        AttackDetector attacks = new AttackDetectorImpl(options::parallelAttackScan);
        this.generator = new MoveGeneratorImpl(attacks, new PinDetectorImpl(),
                new LegalityFilterImpl(attacks), options);
        this.terminal = new TerminalDetectorImpl(generator);
        this.maker = new MoveMakerImpl(generator, terminal);
        this.fen = new FenCodecImpl();
        this.state = initial.copy();
        refreshStatus(this.state);
    }

    /* ── queries ──────────────────────────────────────────────── */

    @Override
    public Set<Coord> legalMoves(Coord square) {
        requireNoPendingPromotion();
        Square sq = state.board().get(square);
        if (sq.isEmpty()) throw new IllegalSelectionException("no piece on " + square);
        if (sq.color() != state.turn()) {
            throw new IllegalSelectionException(square + " holds a " + sq.color() + " piece but "
                    + state.turn() + " is to move");
        }
        return Collections.unmodifiableSet(generator.generateMoves(state, square));
    }

    @Override
    public boolean isInCheck(Side side) {
        return generator.isInCheck(state, side);
    }

    @Override
    public Square pieceAt(Coord square) {
        return state.board().get(square);
    }

    @Override
    public Side sideToMove() {
        return state.turn();
    }

    @Override
    public GameState state() {
        return state.copy();
    }

    /* ── moves ────────────────────────────────────────────────── */

    @Override
    public MoveOutcome applyMove(Coord from, Coord to, Optional<PieceKind> promotion) {
        Objects.requireNonNull(promotion, "promotion");
        promotion.ifPresent(kind -> {
            if (!kind.isPromotionChoice()) throw new IllegalArgumentException("cannot promote to " + kind);
        });
        if (!legalMoves(from).contains(to)) {
            throw new IllegalSelectionException(from + "-" + to + " is not a legal move");
        }
        return maker.make(state, from, to, promotion);
    }

    @Override
    public MoveOutcome completePromotion(PieceKind choice) {
        if (state.pendingPromotion() == null) throw new IllegalSelectionException("no promotion is pending");
        return maker.completePromotion(state, choice);
    }

    /* ── FEN ──────────────────────────────────────────────────── */

    @Override
    public String toFen() {
        return fen.toFen(state);
    }

    @Override
    public GameState fromFen(String text) {
        GameState loaded;
        try {
            loaded = fen.fromFen(text);
        } catch (MalformedFenException e) {
            LOG.warn("Rejected FEN: {}", e.getMessage());
            throw e;
        }
        refreshStatus(loaded);
        state = loaded;
        LOG.debug("Loaded position {}", text);
        return loaded.copy();
    }

    /* ── board editing ────────────────────────────────────────── */

    @Override
    public void placePiece(PieceKind kind, Side color, Coord square) {
        requireNoPendingPromotion();
        if (kind == PieceKind.EMPTY) {
            clearSquare(square);
            return;
        }
        Square placed = Square.of(kind, color);
        if (kind == PieceKind.KING) {
            Coord previous = state.kingCoord(color);
            if (previous != null && !previous.equals(square)) state.board().clear(previous);
        }

        vacate(square);
        state.board().set(square, placed);

        if (kind == PieceKind.KING) {
            state.setKingCoord(color, square);
            state.clearCastlingRights(color);
        }
        afterEdit();
    }

    @Override
    public void clearSquare(Coord square) {
        requireNoPendingPromotion();
        vacate(square);
        afterEdit();
    }

    @Override
    public void clearBoard() {
        requireNoPendingPromotion();
        state.board().clearAll();
        for (Side side : new Side[] {Side.WHITE, Side.BLACK}) {
            state.setKingCoord(side, null);
            state.clearCastlingRights(side);
        }
        state.setEnPassantTarget(null);
        afterEdit();
    }

    @Override
    public void reset() {
        state = GameState.standard();
        refreshStatus(state);
    }

    /* ── internals ────────────────────────────────────────────── */

    /** Empties a square, keeping king coordinates and castling rights in step with the board. */
    private void vacate(Coord square) {
        Square old = state.board().get(square);
        state.board().clear(square);
        switch (old.piece()) {
            case KING -> {
                state.setKingCoord(old.color(), null);
                state.clearCastlingRights(old.color());
            }
            case ROOK -> MoveMakerImpl.dropRightForCorner(state, old.color(), square);
            case QUEEN, BISHOP, KNIGHT, PAWN, EMPTY -> {
            }
        }
    }

    private void afterEdit() {
        refreshStatus(state);
    }

    private void refreshStatus(GameState s) {
        s.setCheck(generator.isInCheck(s, s.turn()));
        s.setTerminal(terminal.classify(s));
    }

    private void requireNoPendingPromotion() {
        if (state.pendingPromotion() != null) {
            throw new IllegalSelectionException("promotion pending on " + state.pendingPromotion());
        }
    }
}
