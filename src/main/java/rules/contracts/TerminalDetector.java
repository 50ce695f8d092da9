package rules.contracts;

import rules.constants.Terminal;
import rules.state.GameState;

public interface TerminalDetector {

    /** Checkmate, stalemate or {@link Terminal#NONE} for the side to move. */
    Terminal classify(GameState state);
}
