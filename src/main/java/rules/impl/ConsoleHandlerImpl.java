package rules.impl;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.constants.Terminal;
import rules.contracts.ConsoleHandler;
import rules.contracts.RulesEngine;
import rules.contracts.RulesOptions;
import rules.interaction.InteractionMode;
import rules.interaction.InteractionMode.Event;
import rules.records.Coord;
import rules.records.MoveOutcome;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;
import java.util.stream.Collectors;

/**
 * Text front-end over {@link RulesEngine}.
 *
 * <p>Which commands are accepted depends on the current {@link InteractionMode}:
 * <pre>
 * GAMEPLAY       moves &lt;sq&gt; | move &lt;from&gt;&lt;to&gt;[q|r|b|n] | position startpos | position fen …
 *                | edit | setoption name … value … | options | perft &lt;depth&gt;
 * PROMOTE_PAWN   q | r | b | n
 * EDIT_BOARD     &lt;k|q|r|b|n|p&gt; &lt;sq&gt; | delete &lt;sq&gt; | clear | done
 * CHOOSE_COLOUR  w | b
 * any mode       d | fen | quit
 * </pre>
 * Engine errors are reported as {@code error <message>} and never end the loop.
 */
public final class ConsoleHandlerImpl implements ConsoleHandler {

    /* ── collaborators ────────────────────────────────────────── */
    private final RulesEngine engine;
    private final RulesOptions opts;
    private final InputStream in;
    private final PrintStream out;

    /* ── front-end state ──────────────────────────────────────── */
    private InteractionMode mode = InteractionMode.GAMEPLAY;
    private PieceKind pieceToPlace;
    private Coord placeSquare;

    public ConsoleHandlerImpl(RulesEngine engine, RulesOptions opts, InputStream in, PrintStream out) {
        this.engine = engine;
        this.opts = opts;
        this.in = in;
        this.out = out;
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override
    public void runLoop() {
        try (Scanner sc = new Scanner(in)) {
            while (sc.hasNextLine()) {
                String line = sc.nextLine().trim();
                if (!line.isEmpty() && handle(line)) break;   // "quit" → exit
            }
        }
    }

    public InteractionMode mode() {
        return mode;
    }

    /* ── router ───────────────────────────────────────────────── */
    boolean handle(String cmd) {
        String[] t = cmd.split("\\s+");
        try {
            switch (t[0]) {
                case "quit" -> mode = mode.next(Event.QUIT);
                case "d" -> out.println(engine.state().board().toDiagram() + "\n" + engine.toFen());
                case "fen" -> out.println(engine.toFen());
                default -> {
                    switch (mode) {
                        case GAMEPLAY -> gameplay(cmd, t);
                        case PROMOTE_PAWN -> promote(t);
                        case EDIT_BOARD -> editBoard(t);
                        case CHOOSE_COLOUR -> chooseColour(t);
                        case EXIT_GAME -> { }
                    }
                }
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            out.println("error " + e.getMessage());
        }
        return mode.isTerminal();
    }

    /* ── gameplay ─────────────────────────────────────────────── */

    private void gameplay(String cmd, String[] t) {
        switch (t[0]) {
            case "moves" -> cmdMoves(t);
            case "move" -> cmdMove(t);
            case "position" -> cmdPosition(t);
            case "edit" -> mode = mode.next(Event.ENTER_EDIT);
            case "setoption" -> {
                if (!opts.setOption(cmd)) out.println("error cannot apply: " + cmd);
            }
            case "options" -> opts.describeOptions().forEach(out::println);
            case "perft" -> cmdPerft(t);
            default -> out.println("error unknown command: " + cmd);
        }
    }

    private void cmdMoves(String[] t) {
        requireArgs(t, 2);
        Coord sq = Coord.parse(t[1]);
        String list = engine.legalMoves(sq).stream()
                .map(Coord::toAlgebraic)
                .sorted()
                .collect(Collectors.joining(" "));
        out.println("moves " + sq + ": " + list);
    }

    private void cmdMove(String[] t) {
        requireArgs(t, 2);
        String mv = t[1];
        if (mv.length() != 4 && mv.length() != 5) throw new IllegalArgumentException("bad move: " + mv);

        Coord from = Coord.parse(mv.substring(0, 2));
        Coord to = Coord.parse(mv.substring(2, 4));
        Optional<PieceKind> promo = mv.length() == 5 ? Optional.of(promotionPiece(mv.charAt(4))) : Optional.empty();

        report(engine.applyMove(from, to, promo));
    }

    private void cmdPosition(String[] t) {
        requireArgs(t, 2);
        if ("startpos".equals(t[1])) {
            engine.reset();
        } else if ("fen".equals(t[1])) {
            engine.fromFen(String.join(" ", Arrays.copyOfRange(t, 2, t.length)));
        } else {
            throw new IllegalArgumentException("expected startpos or fen");
        }
        out.println(engine.toFen());
    }

    private void cmdPerft(String[] t) {
        requireArgs(t, 2);
        int depth = Integer.parseInt(t[1]);
        Map<String, Long> split = Perft.withOptions(opts).divide(engine.state(), Math.max(1, depth));
        split.forEach((mv, n) -> out.println(mv + ": " + n));
        out.println("nodes " + split.values().stream().mapToLong(Long::longValue).sum());
    }

    /* ── promotion ────────────────────────────────────────────── */

    private void promote(String[] t) {
        if (t[0].length() != 1) throw new IllegalArgumentException("choose q, r, b or n");
        PieceKind choice = promotionPiece(t[0].charAt(0));
        MoveOutcome outcome = engine.completePromotion(choice);
        mode = mode.next(Event.PROMOTION_CHOSEN);
        report(outcome);
    }

    /* ── board editing ────────────────────────────────────────── */

    private void editBoard(String[] t) {
        switch (t[0]) {
            case "done" -> mode = mode.next(Event.LEAVE_EDIT);
            case "clear" -> engine.clearBoard();
            case "delete" -> {
                requireArgs(t, 2);
                engine.clearSquare(Coord.parse(t[1]));
            }
            default -> {
                requireArgs(t, 2);
                if (t[0].length() != 1) throw new IllegalArgumentException("unknown edit command: " + t[0]);
                pieceToPlace = PieceKind.fromLetter(t[0].charAt(0))
                        .orElseThrow(() -> new IllegalArgumentException("unknown piece: " + t[0]));
                placeSquare = Coord.parse(t[1]);
                mode = mode.next(Event.PIECE_CHOSEN);
                out.println("colour w|b");
            }
        }
    }

    private void chooseColour(String[] t) {
        Side side = switch (t[0]) {
            case "w" -> Side.WHITE;
            case "b" -> Side.BLACK;
            default -> throw new IllegalArgumentException("choose w or b");
        };
        engine.placePiece(pieceToPlace, side, placeSquare);
        mode = mode.next(Event.COLOUR_CHOSEN);
    }

    /* ── helpers ──────────────────────────────────────────────── */

    private void report(MoveOutcome outcome) {
        if (outcome.pendingPromotion()) {
            mode = mode.next(Event.PROMOTION_PENDING);
            out.println("promote q|r|b|n");
            return;
        }
        mode = mode.next(Event.MOVE_APPLIED);
        if (outcome.terminal() == Terminal.CHECKMATE) out.println("checkmate");
        else if (outcome.terminal() == Terminal.STALEMATE) out.println("stalemate");
        else if (outcome.check()) out.println("check");
        out.println(engine.toFen());
    }

    private static PieceKind promotionPiece(char c) {
        return PieceKind.fromLetter(c)
                .filter(PieceKind::isPromotionChoice)
                .orElseThrow(() -> new IllegalArgumentException("cannot promote to '" + c + "'"));
    }

    private static void requireArgs(String[] t, int n) {
        if (t.length < n) throw new IllegalArgumentException("missing argument for " + t[0]);
    }
}
