package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import rules.constants.Direction;
import rules.constants.Side;
import rules.contracts.PinDetector;
import rules.records.Coord;
import rules.records.PinAxis;

class PinDetectorImplTest {

    private static final FenCodecImpl FEN = new FenCodecImpl();
    private final PinDetector pins = new PinDetectorImpl();

    private Optional<PinAxis> pin(String fen, String square, Side side) {
        return pins.checkForPin(FEN.fromFen(fen), Coord.parse(square), side);
    }

    @Test
    void rookPinsAlongTheFile() {
        Optional<PinAxis> axis = pin("k3r3/8/8/8/8/8/4B3/4K3 w - - 0 1", "e2", Side.WHITE);
        assertEquals(Optional.of(new PinAxis(Direction.D, Direction.U)), axis);
    }

    @Test
    void bishopPinsAlongTheDiagonal() {
        Optional<PinAxis> axis = pin("k7/8/8/8/1b6/8/3N4/4K3 w - - 0 1", "d2", Side.WHITE);
        assertTrue(axis.isPresent());
        assertEquals(Direction.DR, axis.get().towardKing());
        assertEquals(Direction.UL, axis.get().awayFromKing());
    }

    @Test
    void sliderThatCannotMoveAlongTheLineDoesNotPin() {
        assertTrue(pin("k7/8/8/8/1r6/8/3N4/4K3 w - - 0 1", "d2", Side.WHITE).isEmpty());
        assertTrue(pin("k3b3/8/8/8/8/8/4B3/4K3 w - - 0 1", "e2", Side.WHITE).isEmpty());
    }

    @Test
    void queenPinsOnBothKindsOfLine() {
        assertTrue(pin("k3q3/8/8/8/8/8/4B3/4K3 w - - 0 1", "e2", Side.WHITE).isPresent());
        assertTrue(pin("k7/8/8/8/1q6/8/3N4/4K3 w - - 0 1", "d2", Side.WHITE).isPresent());
    }

    @Test
    void anyPieceBehindStopsThePin() {
        // enemy non-slider first
        assertTrue(pin("k3r3/8/8/8/4p3/8/4B3/4K3 w - - 0 1", "e2", Side.WHITE).isEmpty());
        // own piece first
        assertTrue(pin("k3r3/8/8/8/4P3/8/4B3/4K3 w - - 0 1", "e2", Side.WHITE).isEmpty());
    }

    @Test
    void pieceBetweenKingAndCandidateMeansNoPin() {
        assertTrue(pin("k3r3/8/8/8/4B3/8/4N3/4K3 w - - 0 1", "e4", Side.WHITE).isEmpty());
    }

    @Test
    void notAlignedWithKing() {
        assertTrue(pin("k3r3/8/8/8/8/8/2B5/4K3 w - - 0 1", "c2", Side.WHITE).isEmpty());
    }

    @Test
    void blackPiecesArePinnedToo() {
        Optional<PinAxis> axis = pin("4k3/4n3/8/8/8/8/8/K3R3 b - - 0 1", "e7", Side.BLACK);
        assertEquals(Optional.of(new PinAxis(Direction.U, Direction.D)), axis);
    }

    @Test
    void noKingNoPin() {
        assertTrue(pin("4r3/8/8/8/8/8/4B3/8 w - - 0 1", "e2", Side.WHITE).isEmpty());
    }
}
