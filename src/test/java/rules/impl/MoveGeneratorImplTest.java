package rules.impl;

import static org.junit.jupiter.api.Assertions.*;
import static rules.constants.RulesConstants.START_FEN;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.contracts.MoveGenerator;
import rules.contracts.RulesOptions;
import rules.records.Coord;
import rules.state.GameState;

class MoveGeneratorImplTest {

    private static final FenCodecImpl FEN = new FenCodecImpl();

    private static MoveGenerator generator(boolean strictCastling) {
        RulesOptions opts = new RulesOptionsImpl();
        opts.setOption("setoption name StrictCastling value " + strictCastling);
        AttackDetector attacks = new AttackDetectorImpl();
        return new MoveGeneratorImpl(attacks, new PinDetectorImpl(), new LegalityFilterImpl(attacks), opts);
    }

    private static Set<String> moves(MoveGenerator gen, String fen, String square) {
        return gen.generateMoves(FEN.fromFen(fen), Coord.parse(square)).stream()
                .map(Coord::toAlgebraic)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static Set<String> moves(String fen, String square) {
        return moves(generator(true), fen, square);
    }

    private static Set<String> set(String... squares) {
        return new TreeSet<>(Set.of(squares));
    }

    /* ── basics ───────────────────────────────────────────────── */

    @Test
    void startingPosition() {
        String fen = START_FEN;
        assertEquals(set("e3", "e4"), moves(fen, "e2"));
        assertEquals(set("f3", "h3"), moves(fen, "g1"));
        assertEquals(set(), moves(fen, "a1"));
        assertEquals(set(), moves(fen, "d1"));
        assertEquals(set("a6", "c6"), moves(fen, "b8"));
        assertEquals(set(), moves(fen, "e4"));
    }

    @Test
    void rookOnOpenBoard() {
        Set<String> got = moves("k7/8/8/8/3R4/8/8/7K w - - 0 1", "d4");
        assertEquals(14, got.size());
        assertTrue(got.containsAll(set("d8", "d1", "a4", "h4")));
    }

    @Test
    void slidersStopOnCaptures() {
        assertEquals(set("a7", "b6", "c5", "e5", "f6", "g7", "b2", "c3", "e3", "f2", "g1"),
                moves("k7/6p1/8/8/3B4/8/1p6/7K w - - 0 1", "d4"));
    }

    /* ── pawns ────────────────────────────────────────────────── */

    @Test
    void pawnDoubleStepNeedsBothSquaresEmpty() {
        assertEquals(set(), moves("k7/8/8/8/8/4n3/4P3/4K3 w - - 0 1", "e2"));
        assertEquals(set("e3"), moves("k7/8/8/8/4n3/8/4P3/4K3 w - - 0 1", "e2"));
        assertEquals(set("d6", "d5"), moves("4k3/3p4/8/8/8/8/8/4K3 b - - 0 1", "d7"));
    }

    @Test
    void pawnCapturesDiagonallyOnly() {
        assertEquals(set("d5", "e5", "f5"), moves("4k3/8/8/3p1n2/4P3/8/8/4K3 w - - 0 1", "e4"));
        assertEquals(set("e5"), moves("4k3/8/8/3P1P2/4P3/8/8/4K3 w - - 0 1", "e4"));
    }

    @Test
    void enPassantIsOffered() {
        assertEquals(set("d6", "e6"), moves("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 2", "e5"));
    }

    @Test
    void enPassantNeedsAnEnemyPawnBesideTheCapturer() {
        assertEquals(set("d6"), moves("4k3/8/8/3PB3/8/8/8/4K3 w - e6 0 1", "d5"));
        assertEquals(set("d6"), moves("4k3/8/8/3Pn3/8/8/8/4K3 w - e6 0 1", "d5"));
    }

    @Test
    void enPassantThatExposesTheKingAlongTheRankIsRefused() {
        assertEquals(set("b6"), moves("8/8/8/KPp4r/8/8/8/4k3 w - c6 0 1", "b5"));
    }

    @Test
    void enPassantMayCaptureTheCheckingPawn() {
        assertEquals(set("d3"), moves("8/8/8/2k5/3Pp3/8/8/4K3 b - d3 0 1", "e4"));
    }

    /* ── pins ─────────────────────────────────────────────────── */

    @Test
    void pinnedBishopCannotMove() {
        assertEquals(set(), moves("k3r3/8/8/8/8/8/4B3/4K3 w - - 0 1", "e2"));
    }

    @Test
    void pinnedRookSlidesAlongThePin() {
        assertEquals(set("e3", "e4", "e5", "e6", "e7", "e8"), moves("k3r3/8/8/8/8/8/4R3/4K3 w - - 0 1", "e2"));
    }

    @Test
    void pinnedKnightIsFrozen() {
        assertEquals(set(), moves("k7/8/8/8/1b6/8/3N4/4K3 w - - 0 1", "d2"));
    }

    @Test
    void diagonallyPinnedPawnMayCaptureThePinner() {
        assertEquals(set("c3"), moves("k7/8/8/8/8/2b5/3P4/4K3 w - - 0 1", "d2"));
    }

    /* ── check ────────────────────────────────────────────────── */

    @Test
    void kingStepsOutOfCheck() {
        assertEquals(set("d1", "d2", "f1", "f2"), moves("k3r3/8/8/8/8/8/8/4K3 w - - 0 1", "e1"));
    }

    @Test
    void kingCannotCaptureADefendedPiece() {
        assertFalse(moves("k3r3/8/8/8/8/8/4q3/4K3 w - - 0 1", "e1").contains("e2"));
        assertTrue(moves("k7/8/8/8/8/8/4q3/4K3 w - - 0 1", "e1").contains("e2"));
    }

    @Test
    void onlyInterpositionsSurviveCheck() {
        assertEquals(set("e3"), moves("k3r3/8/8/8/8/8/3B4/4K3 w - - 0 1", "d2"));
    }

    @Test
    void isInCheckFollowsTheKing() {
        MoveGenerator gen = generator(true);
        GameState s = FEN.fromFen("k3r3/8/8/8/8/8/8/4K3 w - - 0 1");
        assertTrue(gen.isInCheck(s, Side.WHITE));
        assertFalse(gen.isInCheck(s, Side.BLACK));
        assertFalse(gen.isInCheck(FEN.fromFen("4r3/8/8/8/8/8/8/8 w - - 0 1"), Side.WHITE));
    }

    /* ── castling ─────────────────────────────────────────────── */

    @Test
    void castlesBothWays() {
        assertEquals(set("c1", "d1", "d2", "e2", "f1", "f2", "g1"),
                moves("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1", "e1"));
        assertEquals(set("c8", "d8", "d7", "e7", "f8", "f7", "g8"),
                moves("r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1", "e8"));
    }

    @Test
    void castlingNeedsTheRight() {
        Set<String> got = moves("r3k2r/8/8/8/8/8/8/R3K2R w Qkq - 0 1", "e1");
        assertTrue(got.contains("c1"));
        assertFalse(got.contains("g1"));
    }

    @Test
    void castlingNeedsTheRookAtHome() {
        assertFalse(moves("r3k2r/8/8/8/8/8/8/R3K1R1 w KQkq - 0 1", "e1").contains("g1"));
    }

    @Test
    void castlingNeedsEmptySquares() {
        Set<String> got = moves("r3k2r/8/8/8/8/8/8/RN2K1NR w KQkq - 0 1", "e1");
        assertFalse(got.contains("c1"));
        assertFalse(got.contains("g1"));
    }

    @Test
    void cannotCastleThroughAttack() {
        Set<String> got = moves("4kr2/8/8/8/8/8/8/R3K2R w KQ - 0 1", "e1");
        assertTrue(got.contains("c1"));
        assertFalse(got.contains("g1"));
        assertFalse(got.contains("f1"));
    }

    @Test
    void strictCastlingRefusesWhileInCheck() {
        String fen = "k7/8/8/4q3/8/8/8/R3K2R w KQ - 0 1";
        Set<String> strict = moves(generator(true), fen, "e1");
        assertFalse(strict.contains("g1"));
        assertFalse(strict.contains("c1"));

        Set<String> legacy = moves(generator(false), fen, "e1");
        assertTrue(legacy.contains("g1"));
        assertTrue(legacy.contains("c1"));
    }

    @Test
    void attackedKnightSquareOnlyBlocksLegacyCastling() {
        String fen = "1r2k3/8/8/8/8/8/8/R3K3 w Q - 0 1";
        assertTrue(moves(generator(true), fen, "e1").contains("c1"));
        assertFalse(moves(generator(false), fen, "e1").contains("c1"));
    }

    /* ── generation leaves the state alone ────────────────────── */

    @Test
    void generationDoesNotMutateState() {
        MoveGenerator gen = generator(true);
        GameState s = FEN.fromFen("8/8/8/2k5/3Pp3/8/8/4K3 b - d3 0 1");
        GameState before = s.copy();
        for (int y = 0; y < 8; y++)
            for (int x = 0; x < 8; x++)
                gen.generateMoves(s, Coord.of(x, y));
        assertEquals(before, s);
        assertEquals(before.kingCoord(Side.BLACK), s.kingCoord(Side.BLACK));
    }
}
