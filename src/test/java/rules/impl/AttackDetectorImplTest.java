package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.records.Coord;
import rules.state.Board;

class AttackDetectorImplTest {

    private static final FenCodecImpl FEN = new FenCodecImpl();
    private final AttackDetector attacks = new AttackDetectorImpl();

    private static Board board(String fen) {
        return FEN.fromFen(fen).board();
    }

    private boolean attacked(String fen, String square, Side by) {
        return attacks.isAttacked(board(fen), Coord.parse(square), by);
    }

    /* ── sliders ──────────────────────────────────────────────── */

    @Test
    void rookSeesAlongOpenLines() {
        String fen = "4k3/8/8/8/8/8/8/R3K3 w - - 0 1";
        assertTrue(attacked(fen, "a8", Side.WHITE));
        assertTrue(attacked(fen, "d1", Side.WHITE));
        assertFalse(attacked(fen, "b2", Side.WHITE));
        assertFalse(attacked(fen, "e8", Side.WHITE));
    }

    @Test
    void firstPieceOnTheRayStopsTheScan() {
        String fen = "4k3/8/8/8/8/8/P7/R3K3 w - - 0 1";
        assertFalse(attacked(fen, "a8", Side.WHITE));
        // a defender in between shields just as well
        assertFalse(attacked("4k3/8/8/8/8/8/8/r1N1K3 w - - 0 1", "e1", Side.BLACK));
        assertTrue(attacked("4k3/8/8/8/8/8/8/r3K3 w - - 0 1", "e1", Side.BLACK));
    }

    @Test
    void bishopOnlyOnDiagonals() {
        String fen = "4k3/8/8/3b4/8/8/8/4K3 w - - 0 1";
        assertTrue(attacked(fen, "a2", Side.BLACK));
        assertTrue(attacked(fen, "h1", Side.BLACK));
        assertFalse(attacked(fen, "d1", Side.BLACK));
    }

    /* ── step pieces ──────────────────────────────────────────── */

    @Test
    void knightJumps() {
        String fen = "4k3/8/8/8/8/8/8/1N2K3 w - - 0 1";
        assertTrue(attacked(fen, "c3", Side.WHITE));
        assertTrue(attacked(fen, "a3", Side.WHITE));
        assertTrue(attacked(fen, "d2", Side.WHITE));
        assertFalse(attacked(fen, "d3", Side.WHITE));
    }

    @Test
    void pawnsAttackDiagonallyForwardOnly() {
        String fen = "4k3/8/8/3p4/8/8/8/4K3 w - - 0 1";
        assertTrue(attacked(fen, "e4", Side.BLACK));
        assertTrue(attacked(fen, "c4", Side.BLACK));
        assertFalse(attacked(fen, "d4", Side.BLACK));
        assertFalse(attacked(fen, "e6", Side.BLACK));

        String white = "4k3/8/8/8/8/8/P7/4K3 w - - 0 1";
        assertTrue(attacked(white, "b3", Side.WHITE));
        assertFalse(attacked(white, "a3", Side.WHITE));
        assertFalse(attacked(white, "b1", Side.WHITE));
    }

    @Test
    void kingAttacksAdjacentSquaresOnly() {
        String fen = "4k3/8/8/8/8/8/8/4K3 w - - 0 1";
        assertTrue(attacked(fen, "d7", Side.BLACK));
        assertTrue(attacked(fen, "f8", Side.BLACK));
        assertFalse(attacked(fen, "d6", Side.BLACK));
        assertFalse(attacked(fen, "e6", Side.BLACK));
    }

    @Test
    void emptyBoardIsQuiet() {
        Board empty = new Board();
        for (int y = 0; y < 8; y++)
            for (int x = 0; x < 8; x++)
                assertFalse(attacks.isAttacked(empty, Coord.of(x, y), Side.WHITE));
    }

    /* ── parallel scan agrees with the sequential one ─────────── */

    @ParameterizedTest
    @ValueSource(strings = {
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1"
    })
    void parallelMatchesSequential(String fen) {
        Board b = board(fen);
        AttackDetector parallel = new AttackDetectorImpl(() -> true);
        for (Side side : new Side[] {Side.WHITE, Side.BLACK}) {
            for (int y = 0; y < 8; y++) {
                for (int x = 0; x < 8; x++) {
                    Coord c = Coord.of(x, y);
                    assertEquals(attacks.isAttacked(b, c, side), parallel.isAttacked(b, c, side),
                            () -> side + " on " + c);
                }
            }
        }
    }
}
