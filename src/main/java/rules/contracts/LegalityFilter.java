package rules.contracts;

import rules.records.Coord;
import rules.state.GameState;

import java.util.Collection;
import java.util.Set;

public interface LegalityFilter {

    /**
     * Keeps the candidates after which the mover's king is not attacked. Each candidate is
     * simulated, queried and reverted before the next one is tried.
     */
    Set<Coord> filter(GameState state, Coord from, Collection<Coord> candidates);
}
