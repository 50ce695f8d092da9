package bench;

import rules.constants.Side;
import rules.contracts.AttackDetector;
import rules.impl.AttackDetectorImpl;
import rules.impl.FenCodecImpl;
import rules.records.Coord;
import rules.state.Board;

import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/** Micro-benchmark: sequential vs. parallel-stream evaluation of the sixteen attack rays. */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(value = 2)
@State(Scope.Thread)
public class AttackScanBench {

    /** Middlegame-density position so rays stop at realistic distances. */
    @State(Scope.Thread)
    public static class TestData {
        @Param({
                "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
                "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1"
        })
        String fen;

        Board board;

        @Setup(Level.Trial)
        public void init() {
            board = new FenCodecImpl().fromFen(fen).board();
        }
    }

    private final AttackDetector sequential = new AttackDetectorImpl(() -> false);
    private final AttackDetector parallel = new AttackDetectorImpl(() -> true);

    @Benchmark
    public int sequential(TestData td) {
        return scanAll(sequential, td.board);
    }

    @Benchmark
    public int parallel(TestData td) {
        return scanAll(parallel, td.board);
    }

    private static int scanAll(AttackDetector det, Board board) {
        int hits = 0;
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                if (det.isAttacked(board, Coord.of(x, y), Side.BLACK)) hits++;
            }
        }
        return hits;
    }
}
