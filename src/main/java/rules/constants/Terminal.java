package rules.constants;

/** Classification of a position for the side to move. */
public enum Terminal {
    NONE,
    CHECKMATE,
    STALEMATE
}
