package rules.state;

import static rules.constants.RulesConstants.*;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.constants.Terminal;
import rules.records.Coord;
import rules.records.Square;
import rules.records.UndoRecord;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable game record: board, side to move, king coordinates, castling rights, en-passant
 * target and the two move counters.
 *
 * <p>A king coordinate is {@code null} only while the board-editing surface has left that side
 * without a king. Equality covers every field FEN can express plus a pending promotion; the
 * derived check flag and terminal classification are excluded.
 */
public final class GameState {

    private final Board board;
    private Side turn;
    private final Coord[] kingCoords = new Coord[2];
    private final boolean[][] castlingRights = new boolean[2][2];
    private Coord enPassantTarget;
    private int halfmoveClock;
    private int fullmoveNumber;

    /* ────── transient status, recomputed after every mutation ────── */
    private Coord pendingPromotion;
    private boolean check;
    private Terminal terminal = Terminal.NONE;

    public GameState(Board board) {
        this.board = Objects.requireNonNull(board, "board");
        this.turn = Side.WHITE;
        this.fullmoveNumber = 1;
    }

    /** Orthodox starting position, White to move, all rights intact. */
    public static GameState standard() {
        GameState s = new GameState(Board.standard());
        s.kingCoords[Side.WHITE.index()] = Coord.of(KING_HOME_FILE, Side.WHITE.homeRow());
        s.kingCoords[Side.BLACK.index()] = Coord.of(KING_HOME_FILE, Side.BLACK.homeRow());
        for (boolean[] rights : s.castlingRights) Arrays.fill(rights, true);
        return s;
    }

    public GameState copy() {
        GameState s = new GameState(board.copy());
        s.turn = turn;
        s.kingCoords[0] = kingCoords[0];
        s.kingCoords[1] = kingCoords[1];
        for (int i = 0; i < 2; i++) s.castlingRights[i] = castlingRights[i].clone();
        s.enPassantTarget = enPassantTarget;
        s.halfmoveClock = halfmoveClock;
        s.fullmoveNumber = fullmoveNumber;
        s.pendingPromotion = pendingPromotion;
        s.check = check;
        s.terminal = terminal;
        return s;
    }

    /* ────── simulate / revert ────── */

    /**
     * Plays {@code from → to} on the board without touching rights, clocks or turn. When the king
     * moves its tracked coordinate is updated first.
     *
     * @param sideSquare an extra square to empty (the en-passant victim), or {@code null}
     * @return the record {@link #revert(UndoRecord)} needs to restore the exact prior position
     */
    public UndoRecord simulate(Coord from, Coord to, Coord sideSquare) {
        Square moved = board.get(from);
        Square captured = board.get(to);
        Square sideContents = sideSquare == null ? null : board.get(sideSquare);

        Coord priorKing = null;
        if (moved.piece() == PieceKind.KING) {
            priorKing = kingCoords[moved.color().index()];
            kingCoords[moved.color().index()] = to;
        }

        board.clear(from);
        board.set(to, moved);
        if (sideSquare != null) board.clear(sideSquare);

        return new UndoRecord(from, moved, to, captured, sideSquare, sideContents, priorKing);
    }

    public void revert(UndoRecord undo) {
        if (undo.sideSquare() != null) board.set(undo.sideSquare(), undo.sideContents());
        board.set(undo.to(), undo.captured());
        board.set(undo.from(), undo.moved());
        if (undo.priorKing() != null) kingCoords[undo.moved().color().index()] = undo.priorKing();
    }

    /**
     * Square of the pawn an en-passant capture {@code from → to} removes, or {@code null} when the
     * move is not an en-passant capture. The victim must be an enemy pawn beside {@code from}.
     */
    public Coord enPassantVictim(Coord from, Coord to) {
        if (enPassantTarget == null || !enPassantTarget.equals(to)) return null;
        Square mover = board.get(from);
        if (mover.piece() != PieceKind.PAWN) return null;
        if (from.x() == to.x() || !board.get(to).isEmpty()) return null;
        Coord victim = Coord.of(to.x(), from.y());
        return board.get(victim).is(PieceKind.PAWN, mover.color().opposite()) ? victim : null;
    }

    /* ────── accessors ────── */

    public Board board() {
        return board;
    }

    public Side turn() {
        return turn;
    }

    public void setTurn(Side turn) {
        if (turn == Side.NONE) throw new IllegalArgumentException("NONE cannot be to move");
        this.turn = turn;
    }

    public Coord kingCoord(Side side) {
        return kingCoords[side.index()];
    }

    public void setKingCoord(Side side, Coord coord) {
        kingCoords[side.index()] = coord;
    }

    public boolean hasCastlingRight(Side side, int wing) {
        return castlingRights[side.index()][wing];
    }

    public void setCastlingRight(Side side, int wing, boolean value) {
        castlingRights[side.index()][wing] = value;
    }

    public void clearCastlingRights(Side side) {
        Arrays.fill(castlingRights[side.index()], false);
    }

    public Coord enPassantTarget() {
        return enPassantTarget;
    }

    public void setEnPassantTarget(Coord target) {
        this.enPassantTarget = target;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public void setHalfmoveClock(int halfmoveClock) {
        this.halfmoveClock = halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    public void setFullmoveNumber(int fullmoveNumber) {
        this.fullmoveNumber = fullmoveNumber;
    }

    public Coord pendingPromotion() {
        return pendingPromotion;
    }

    public void setPendingPromotion(Coord pendingPromotion) {
        this.pendingPromotion = pendingPromotion;
    }

    public boolean check() {
        return check;
    }

    public void setCheck(boolean check) {
        this.check = check;
    }

    public Terminal terminal() {
        return terminal;
    }

    public void setTerminal(Terminal terminal) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    /* ────── equality ────── */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState s)) return false;
        return turn == s.turn
                && halfmoveClock == s.halfmoveClock
                && fullmoveNumber == s.fullmoveNumber
                && board.equals(s.board)
                && Arrays.equals(kingCoords, s.kingCoords)
                && Arrays.deepEquals(castlingRights, s.castlingRights)
                && Objects.equals(enPassantTarget, s.enPassantTarget)
                && Objects.equals(pendingPromotion, s.pendingPromotion);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(board, turn, enPassantTarget, halfmoveClock, fullmoveNumber, pendingPromotion);
        h = 31 * h + Arrays.hashCode(kingCoords);
        return 31 * h + Arrays.deepHashCode(castlingRights);
    }

    @Override
    public String toString() {
        return board.toDiagram() + "\n" + turn + " to move, halfmove " + halfmoveClock
                + ", fullmove " + fullmoveNumber;
    }
}
