package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import rules.constants.Terminal;
import rules.contracts.AttackDetector;
import rules.contracts.MoveGenerator;
import rules.contracts.TerminalDetector;

class TerminalDetectorImplTest {

    private static final FenCodecImpl FEN = new FenCodecImpl();

    private static TerminalDetector detector() {
        AttackDetector attacks = new AttackDetectorImpl();
        MoveGenerator gen = new MoveGeneratorImpl(attacks, new PinDetectorImpl(),
                new LegalityFilterImpl(attacks), new RulesOptionsImpl());
        return new TerminalDetectorImpl(gen);
    }

    @ParameterizedTest(name = "{1}: {0}")
    @CsvSource(delimiter = '|', value = {
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1 | NONE",
            "rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3 | CHECKMATE",
            "R5k1/5ppp/8/8/8/8/8/6K1 b - - 0 1 | CHECKMATE",
            "7k/5Q2/6K1/8/8/8/8/8 b - - 0 1 | STALEMATE",
            "k7/8/1Q6/8/8/8/8/7K b - - 0 1 | STALEMATE",
            "6k1/5ppp/8/8/8/8/8/R5K1 b - - 0 1 | NONE",
            "k3r3/8/8/8/8/8/8/4K3 w - - 0 1 | NONE"
    })
    void classify(String fen, Terminal expected) {
        assertEquals(expected, detector().classify(FEN.fromFen(fen)));
    }
}
