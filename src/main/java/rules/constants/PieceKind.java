package rules.constants;

import static rules.constants.Direction.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The six orthodox piece kinds plus {@link #EMPTY}. Every per-kind table (move sets, FEN letters,
 * slider classification) is an exhaustive switch so that a new kind fails to compile until each
 * table handles it.
 */
public enum PieceKind {
    KING,
    QUEEN,
    ROOK,
    BISHOP,
    KNIGHT,
    PAWN,
    EMPTY;

    /* ────── immutable move-set tables ────── */
    private static final Set<Direction> ORTHOGONAL = freeze(EnumSet.of(U, D, L, R));
    private static final Set<Direction> DIAGONAL = freeze(EnumSet.of(UR, UL, DR, DL));
    private static final Set<Direction> ROYAL = freeze(EnumSet.of(U, D, L, R, UR, UL, DR, DL));
    private static final Set<Direction> KNIGHT_L =
            freeze(EnumSet.of(RRU, RUU, RRD, RDD, LLU, LUU, LLD, LDD));
    private static final Set<Direction> WHITE_PAWN = freeze(EnumSet.of(U, UL, UR));
    private static final Set<Direction> BLACK_PAWN = freeze(EnumSet.of(D, DL, DR));
    private static final Set<Direction> NO_MOVES = freeze(EnumSet.noneOf(Direction.class));

    private static Set<Direction> freeze(EnumSet<Direction> set) {
        return Collections.unmodifiableSet(set);
    }

    /**
     * Directions a piece of this kind may step along. Pawns depend on their side: the forward
     * push plus the two forward diagonals.
     */
    public Set<Direction> moveSet(Side side) {
        return switch (this) {
            case KING, QUEEN -> ROYAL;
            case ROOK -> ORTHOGONAL;
            case BISHOP -> DIAGONAL;
            case KNIGHT -> KNIGHT_L;
            case PAWN -> switch (side) {
                case WHITE -> WHITE_PAWN;
                case BLACK -> BLACK_PAWN;
                case NONE -> throw new IllegalArgumentException("a pawn needs a side");
            };
            case EMPTY -> NO_MOVES;
        };
    }

    /** Queens, rooks and bishops travel any distance along their directions. */
    public boolean isSlider() {
        return switch (this) {
            case QUEEN, ROOK, BISHOP -> true;
            case KING, KNIGHT, PAWN, EMPTY -> false;
        };
    }

    /** Kinds a pawn may turn into on the last rank. */
    public boolean isPromotionChoice() {
        return switch (this) {
            case QUEEN, ROOK, BISHOP, KNIGHT -> true;
            case KING, PAWN, EMPTY -> false;
        };
    }

    /** Lower-case FEN letter; {@code '\0'} for {@link #EMPTY}. */
    public char fenLetter() {
        return switch (this) {
            case KING -> 'k';
            case QUEEN -> 'q';
            case ROOK -> 'r';
            case BISHOP -> 'b';
            case KNIGHT -> 'n';
            case PAWN -> 'p';
            case EMPTY -> '\0';
        };
    }

    /** Case-insensitive inverse of {@link #fenLetter()}. */
    public static Optional<PieceKind> fromLetter(char c) {
        return switch (Character.toLowerCase(c)) {
            case 'k' -> Optional.of(KING);
            case 'q' -> Optional.of(QUEEN);
            case 'r' -> Optional.of(ROOK);
            case 'b' -> Optional.of(BISHOP);
            case 'n' -> Optional.of(KNIGHT);
            case 'p' -> Optional.of(PAWN);
            default -> Optional.empty();
        };
    }
}
