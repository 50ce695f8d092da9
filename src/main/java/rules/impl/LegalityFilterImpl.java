package rules.impl;

import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.contracts.LegalityFilter;
import rules.records.Coord;
import rules.records.UndoRecord;
import rules.state.GameState;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Apply-candidate, query, undo. Every candidate mutates the shared board, so the loop is
 * strictly sequential and each simulation is reverted before the next begins.
 */
public final class LegalityFilterImpl implements LegalityFilter {

    private final AttackDetector attacks;

    public LegalityFilterImpl(AttackDetector attacks) {
        this.attacks = Objects.requireNonNull(attacks, "attacks");
    }

    @Override
    public Set<Coord> filter(GameState state, Coord from, Collection<Coord> candidates) {
        Side side = state.board().get(from).color();
        Set<Coord> legal = new LinkedHashSet<>();

        for (Coord to : candidates) {
            Coord victim = state.enPassantVictim(from, to);
            UndoRecord undo = state.simulate(from, to, victim);
            try {
                Coord king = state.kingCoord(side);
                if (king == null || !attacks.isAttacked(state.board(), king, side.opposite())) {
                    legal.add(to);
                }
            } finally {
                state.revert(undo);
            }
        }
        return legal;
    }
}
