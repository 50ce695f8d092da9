package rules.impl;

import static rules.constants.RulesConstants.*;

import rules.constants.Direction;
import rules.constants.PieceKind;
import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.contracts.LegalityFilter;
import rules.contracts.MoveGenerator;
import rules.contracts.PinDetector;
import rules.contracts.RulesOptions;
import rules.records.Coord;
import rules.records.PinAxis;
import rules.records.Square;
import rules.state.Board;
import rules.state.GameState;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Piece-specific destination generator.
 *
 * <p>Pseudo-legal destinations are produced first; pins restrict the usable directions up front,
 * and the legality filter prunes the rest when the side is in check, for every king step and for
 * en-passant captures (a pin along the rank through both pawns is invisible to the pin
 * detector).
 */
public final class MoveGeneratorImpl implements MoveGenerator {

    private final AttackDetector attacks;
    private final PinDetector pins;
    private final LegalityFilter legality;
    private final RulesOptions options;

    public MoveGeneratorImpl(AttackDetector attacks, PinDetector pins, LegalityFilter legality,
                             RulesOptions options) {
        this.attacks = Objects.requireNonNull(attacks, "attacks");
        this.pins = Objects.requireNonNull(pins, "pins");
        this.legality = Objects.requireNonNull(legality, "legality");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public Set<Coord> generateMoves(GameState state, Coord from) {
        Square sq = state.board().get(from);
        if (sq.isEmpty()) return new LinkedHashSet<>();

        Side side = sq.color();
        boolean inCheck = isInCheck(state, side);

        return switch (sq.piece()) {
            case PAWN -> pawnMoves(state, from, sq, inCheck);
            case KNIGHT -> knightMoves(state, from, sq, inCheck);
            case KING -> kingMoves(state, from, sq, inCheck);
            case QUEEN, ROOK, BISHOP -> sliderMoves(state, from, sq, inCheck);
            case EMPTY -> new LinkedHashSet<>();
        };
    }

    @Override
    public boolean isInCheck(GameState state, Side side) {
        Coord king = state.kingCoord(side);
        return king != null && attacks.isAttacked(state.board(), king, side.opposite());
    }

    /* ── pawns ─────────────────────────────────────────────────── */

    private Set<Coord> pawnMoves(GameState state, Coord from, Square pawn, boolean inCheck) {
        Side side = pawn.color();
        Board board = state.board();
        Set<Coord> moves = new LinkedHashSet<>();
        Set<Coord> enPassant = new LinkedHashSet<>();

        for (Direction d : usableDirections(state, from, pawn)) {
            int x = from.x() + d.dx();
            int y = from.y() + d.dy();
            if (!Coord.onBoard(x, y)) continue;
            Square target = board.get(x, y);

            if (d.isOrthogonal()) {
                if (!target.isEmpty()) continue;
                moves.add(Coord.of(x, y));
                int y2 = y + d.dy();
                if (from.y() == side.pawnStartRow() && board.get(x, y2).isEmpty()) {
                    moves.add(Coord.of(x, y2));
                }
            } else if (target.color() == side.opposite()) {
                moves.add(Coord.of(x, y));
            } else if (state.enPassantVictim(from, Coord.of(x, y)) != null) {
                enPassant.add(Coord.of(x, y));
            }
        }

        Set<Coord> legal = inCheck ? legality.filter(state, from, moves) : moves;
        if (!enPassant.isEmpty()) legal.addAll(legality.filter(state, from, enPassant));
        return legal;
    }

    /* ── knights ───────────────────────────────────────────────── */

    private Set<Coord> knightMoves(GameState state, Coord from, Square knight, boolean inCheck) {
        // a knight never lands on the line through its king
        if (pins.checkForPin(state, from, knight.color()).isPresent()) return new LinkedHashSet<>();

        Set<Coord> moves = stepMoves(state.board(), from, knight);
        return inCheck ? legality.filter(state, from, moves) : moves;
    }

    /* ── king ──────────────────────────────────────────────────── */

    private Set<Coord> kingMoves(GameState state, Coord from, Square king, boolean inCheck) {
        Set<Coord> moves = legality.filter(state, from, stepMoves(state.board(), from, king));

        Side side = king.color();
        if (canCastle(state, from, side, KINGSIDE, inCheck)) moves.add(Coord.of(from.x() + 2, from.y()));
        if (canCastle(state, from, side, QUEENSIDE, inCheck)) moves.add(Coord.of(from.x() - 2, from.y()));
        return moves;
    }

    /**
     * Castling needs the right, the king and rook on their home squares and empty squares in
     * between. The squares the king crosses must not be attacked; strict mode also refuses while
     * in check and only needs the b-file square empty, legacy mode tests every queenside square.
     */
    private boolean canCastle(GameState state, Coord from, Side side, int wing, boolean inCheck) {
        if (!state.hasCastlingRight(side, wing)) return false;

        int row = side.homeRow();
        if (from.x() != KING_HOME_FILE || from.y() != row) return false;

        Board board = state.board();
        int rookFile = wing == KINGSIDE ? KINGSIDE_ROOK_FILE : QUEENSIDE_ROOK_FILE;
        if (!board.get(rookFile, row).is(PieceKind.ROOK, side)) return false;

        boolean strict = options.strictCastling();
        if (strict && inCheck) return false;

        int step = wing == KINGSIDE ? 1 : -1;
        int span = Math.abs(rookFile - from.x()) - 1;
        for (int i = 1; i <= span; i++) {
            int x = from.x() + step * i;
            if (!board.get(x, row).isEmpty()) return false;
            boolean kingCrosses = i <= 2;
            if ((kingCrosses || !strict) && attacks.isAttacked(board, Coord.of(x, row), side.opposite())) {
                return false;
            }
        }
        return true;
    }

    /* ── sliders ───────────────────────────────────────────────── */

    private Set<Coord> sliderMoves(GameState state, Coord from, Square piece, boolean inCheck) {
        Board board = state.board();
        Side side = piece.color();
        Set<Coord> moves = new LinkedHashSet<>();

        for (Direction d : usableDirections(state, from, piece)) {
            int x = from.x();
            int y = from.y();
            for (int step = 1; step <= MAX_RAY; step++) {
                x += d.dx();
                y += d.dy();
                if (!Coord.onBoard(x, y)) break;
                Square target = board.get(x, y);
                if (target.color() == side) break;
                moves.add(Coord.of(x, y));
                if (!target.isEmpty()) break;
            }
        }
        return inCheck ? legality.filter(state, from, moves) : moves;
    }

    /* ── helpers ───────────────────────────────────────────────── */

    private Set<Direction> usableDirections(GameState state, Coord from, Square piece) {
        Optional<PinAxis> pin = pins.checkForPin(state, from, piece.color());
        return pin.isPresent() ? pin.get().restrict(piece.moves()) : piece.moves();
    }

    /** Single steps along the piece's move set onto empty or enemy squares. */
    private static Set<Coord> stepMoves(Board board, Coord from, Square piece) {
        Set<Coord> moves = new LinkedHashSet<>();
        for (Direction d : piece.moves()) {
            int x = from.x() + d.dx();
            int y = from.y() + d.dy();
            if (!Coord.onBoard(x, y)) continue;
            if (board.get(x, y).color() == piece.color()) continue;
            moves.add(Coord.of(x, y));
        }
        return moves;
    }
}
