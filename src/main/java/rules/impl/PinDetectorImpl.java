package rules.impl;

import rules.constants.Direction;
import rules.constants.PieceKind;
import rules.constants.Side;
import rules.contracts.PinDetector;
import rules.records.Coord;
import rules.records.PinAxis;
import rules.records.Square;
import rules.state.Board;
import rules.state.GameState;

import java.util.Optional;

/**
 * Detects absolute pins by walking from the piece toward its king and then away from it.
 */
public final class PinDetectorImpl implements PinDetector {

    @Override
    public Optional<PinAxis> checkForPin(GameState state, Coord pieceSquare, Side side) {
        Coord king = state.kingCoord(side);
        if (king == null) return Optional.empty();

        Optional<Direction> line = Direction.between(pieceSquare, king);
        if (line.isEmpty()) return Optional.empty();

        Direction toward = line.get();
        Direction away = toward.opposite();
        Board board = state.board();

        /* 1) nothing but empty squares up to our own king */
        int x = pieceSquare.x() + toward.dx();
        int y = pieceSquare.y() + toward.dy();
        while (true) {
            if (!Coord.onBoard(x, y)) return Optional.empty();
            Square sq = board.get(x, y);
            if (x == king.x() && y == king.y()) {
                if (!sq.is(PieceKind.KING, side)) return Optional.empty();
                break;
            }
            if (!sq.isEmpty()) return Optional.empty();
            x += toward.dx();
            y += toward.dy();
        }

        /* 2) first piece behind us must be an enemy slider running along this line */
        x = pieceSquare.x() + away.dx();
        y = pieceSquare.y() + away.dy();
        while (Coord.onBoard(x, y)) {
            Square sq = board.get(x, y);
            if (!sq.isEmpty()) {
                boolean pinner = sq.color() == side.opposite()
                        && sq.piece().isSlider()
                        && sq.moves().contains(away);
                return pinner ? Optional.of(new PinAxis(toward, away)) : Optional.empty();
            }
            x += away.dx();
            y += away.dy();
        }
        return Optional.empty();
    }
}
