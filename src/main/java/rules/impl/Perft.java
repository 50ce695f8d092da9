package rules.impl;

import static rules.constants.RulesConstants.BOARD_SIZE;
import static rules.constants.RulesConstants.PROMOTION_CHOICES;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.contracts.MoveGenerator;
import rules.contracts.MoveMaker;
import rules.contracts.RulesOptions;
import rules.records.Coord;
import rules.state.GameState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Leaf-node counter over the legal move tree. A promotion counts once per promotion piece.
 */
public final class Perft {

    private final MoveGenerator generator;
    private final MoveMaker maker;

    public Perft(MoveGenerator generator, MoveMaker maker) {
        this.generator = generator;
        this.maker = maker;
    }

    /** Wires a fresh generator / move maker pair from {@code options}. */
    public static Perft withOptions(RulesOptions options) {
        AttackDetector attacks = new AttackDetectorImpl(options::parallelAttackScan);
        MoveGenerator gen = new MoveGeneratorImpl(attacks, new PinDetectorImpl(),
                new LegalityFilterImpl(attacks), options);
        return new Perft(gen, new MoveMakerImpl(gen, new TerminalDetectorImpl(gen)));
    }

    public long count(GameState root, int depth) {
        if (depth == 0) return 1;
        long nodes = 0;
        Side side = root.turn();

        for (int y = 0; y < BOARD_SIZE; y++) {
            for (int x = 0; x < BOARD_SIZE; x++) {
                if (root.board().get(x, y).color() != side) continue;
                Coord from = Coord.of(x, y);
                for (Coord to : generator.generateMoves(root, from)) {
                    nodes += countMove(root, from, to, depth);
                }
            }
        }
        return nodes;
    }

    /** Per-root-move subtotals, keyed like {@code "e2e4"}; handy for diffing against another engine. */
    public Map<String, Long> divide(GameState root, int depth) {
        Map<String, Long> split = new LinkedHashMap<>();
        Side side = root.turn();
        for (int y = 0; y < BOARD_SIZE; y++) {
            for (int x = 0; x < BOARD_SIZE; x++) {
                if (root.board().get(x, y).color() != side) continue;
                Coord from = Coord.of(x, y);
                for (Coord to : generator.generateMoves(root, from)) {
                    split.put(from.toAlgebraic() + to.toAlgebraic(), countMove(root, from, to, depth));
                }
            }
        }
        return split;
    }

    private long countMove(GameState root, Coord from, Coord to, int depth) {
        boolean promotes = root.board().get(from).piece() == PieceKind.PAWN
                && to.y() == root.turn().promotionRow();

        if (depth == 1) return promotes ? PROMOTION_CHOICES.size() : 1;

        long nodes = 0;
        if (promotes) {
            for (PieceKind choice : PROMOTION_CHOICES) {
                GameState next = root.copy();
                maker.make(next, from, to, Optional.of(choice));
                nodes += count(next, depth - 1);
            }
        } else {
            GameState next = root.copy();
            maker.make(next, from, to, Optional.empty());
            nodes += count(next, depth - 1);
        }
        return nodes;
    }
}
