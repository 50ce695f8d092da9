package rules.interaction;

/**
 * Front-end input modes. Transitions are pure: {@link #next(Event)} never touches the engine,
 * it only maps the current mode and what just happened to the following mode.
 */
public enum InteractionMode {
    GAMEPLAY,
    EDIT_BOARD,
    CHOOSE_COLOUR,
    PROMOTE_PAWN,
    EXIT_GAME;

    /** Things the front-end reports after talking to the engine or the user. */
    public enum Event {
        MOVE_APPLIED,
        PROMOTION_PENDING,
        PROMOTION_CHOSEN,
        ENTER_EDIT,
        PIECE_CHOSEN,
        COLOUR_CHOSEN,
        LEAVE_EDIT,
        QUIT
    }

    /** The mode after {@code event}; events that make no sense in this mode leave it unchanged. */
    public InteractionMode next(Event event) {
        if (event == Event.QUIT) return EXIT_GAME;
        return switch (this) {
            case GAMEPLAY -> switch (event) {
                case PROMOTION_PENDING -> PROMOTE_PAWN;
                case ENTER_EDIT -> EDIT_BOARD;
                default -> GAMEPLAY;
            };
            case EDIT_BOARD -> switch (event) {
                case PIECE_CHOSEN -> CHOOSE_COLOUR;
                case LEAVE_EDIT -> GAMEPLAY;
                default -> EDIT_BOARD;
            };
            case CHOOSE_COLOUR -> event == Event.COLOUR_CHOSEN ? EDIT_BOARD : CHOOSE_COLOUR;
            case PROMOTE_PAWN -> event == Event.PROMOTION_CHOSEN ? GAMEPLAY : PROMOTE_PAWN;
            case EXIT_GAME -> EXIT_GAME;
        };
    }

    public boolean isTerminal() {
        return this == EXIT_GAME;
    }
}
