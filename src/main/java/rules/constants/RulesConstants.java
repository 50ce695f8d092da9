package rules.constants;

import java.util.List;

/**
 * Engine-wide constants.
 */
public final class RulesConstants {

    private RulesConstants() {}

    /* ────────────── Board geometry ────────────── */
    public static final int BOARD_SIZE = 8;
    /** Longest ray a slider can travel on an 8×8 board. */
    public static final int MAX_RAY = 7;

    public static final int KING_HOME_FILE = 4;
    public static final int KINGSIDE_ROOK_FILE = 7;
    public static final int QUEENSIDE_ROOK_FILE = 0;

    /* ────────────── Castling right indices ────────────── */
    public static final int KINGSIDE = 0;
    public static final int QUEENSIDE = 1;

    /* ────────────── FEN ────────────── */
    public static final String START_FEN =
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
    public static final int FEN_FIELDS = 6;

    /** Promotion choices in the order the console offers them. */
    public static final List<PieceKind> PROMOTION_CHOICES =
            List.of(PieceKind.QUEEN, PieceKind.ROOK, PieceKind.BISHOP, PieceKind.KNIGHT);

    /* ────────────── Option names ────────────── */
    public static final String OPT_STRICT_CASTLING = "StrictCastling";
    public static final String OPT_PARALLEL_ATTACK_SCAN = "ParallelAttackScan";
}
