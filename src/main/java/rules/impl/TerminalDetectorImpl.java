package rules.impl;

import static rules.constants.RulesConstants.BOARD_SIZE;

import rules.constants.Side;
import rules.constants.Terminal;
import rules.contracts.MoveGenerator;
import rules.contracts.TerminalDetector;
import rules.records.Coord;
import rules.state.Board;
import rules.state.GameState;

import java.util.Objects;

/** Scans the side to move's pieces; the first piece with a legal move ends the scan. */
public final class TerminalDetectorImpl implements TerminalDetector {

    private final MoveGenerator generator;

    public TerminalDetectorImpl(MoveGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    @Override
    public Terminal classify(GameState state) {
        Side side = state.turn();
        Board board = state.board();

        for (int y = 0; y < BOARD_SIZE; y++) {
            for (int x = 0; x < BOARD_SIZE; x++) {
                if (board.get(x, y).color() != side) continue;
                if (!generator.generateMoves(state, Coord.of(x, y)).isEmpty()) return Terminal.NONE;
            }
        }
        return generator.isInCheck(state, side) ? Terminal.CHECKMATE : Terminal.STALEMATE;
    }
}
