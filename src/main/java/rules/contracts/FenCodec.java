package rules.contracts;

import rules.exceptions.MalformedFenException;
import rules.state.GameState;

public interface FenCodec {

    String toFen(GameState state);

    /**
     * Decodes the six-field FEN text into a fresh state.
     *
     * @throws MalformedFenException if any field is missing or invalid
     */
    GameState fromFen(String fen);
}
