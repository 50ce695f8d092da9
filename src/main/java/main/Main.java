// File: Main.java
package main;

import rules.contracts.ConsoleHandler;
import rules.contracts.RulesEngine;
import rules.contracts.RulesOptions;
import rules.impl.ConsoleHandlerImpl;
import rules.impl.FenCodecImpl;
import rules.impl.Perft;
import rules.impl.RulesEngineImpl;
import rules.impl.RulesOptionsImpl;
import rules.state.GameState;

import java.util.Arrays;

import static rules.constants.RulesConstants.START_FEN;

/**
 * Wire everything together and run the console loop, or {@code perft <depth> [fen]} for a
 * node-count benchmark.
 */
public final class Main {

    public static void main(String[] args) {
        if (args.length > 0 && "perft".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? Integer.parseInt(args[1]) : 4;
            String fen = (args.length > 2) ? String.join(" ", Arrays.copyOfRange(args, 2, args.length)) : START_FEN;
            runPerftBench(depth, fen);
            return;
        }

        System.out.println("chess-rules console");

        RulesOptions opts = new RulesOptionsImpl();
        RulesEngine engine = new RulesEngineImpl(opts);
        ConsoleHandler console = new ConsoleHandlerImpl(engine, opts, System.in, System.out);
        console.runLoop();
    }

    private static void runPerftBench(int depth, String fen) {
        GameState root = new FenCodecImpl().fromFen(fen);
        Perft perft = Perft.withOptions(new RulesOptionsImpl());

        long t0 = System.nanoTime();
        long nodes = perft.count(root, depth);
        long ms = Math.max(1, (System.nanoTime() - t0) / 1_000_000);

        System.out.printf("perft(%d) = %,d nodes  %,d ms  %,d NPS%n", depth, nodes, ms, nodes * 1000 / ms);
    }
}
