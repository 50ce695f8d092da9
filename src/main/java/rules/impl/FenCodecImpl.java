package rules.impl;

import static rules.constants.RulesConstants.*;

import rules.constants.PieceKind;
import rules.constants.Side;
import rules.contracts.FenCodec;
import rules.exceptions.MalformedFenException;
import rules.records.Coord;
import rules.records.Square;
import rules.state.Board;
import rules.state.GameState;

import java.util.Objects;
import java.util.Optional;

/**
 * Six-field Forsyth–Edwards Notation.
 *
 * <p>Decoding builds a scratch {@link GameState} and only hands it out once every field has
 * validated, so a rejected string never leaves a half-written position behind.
 */
public final class FenCodecImpl implements FenCodec {

    @Override
    public String toFen(GameState state) {
        Board board = state.board();
        StringBuilder sb = new StringBuilder(90);

        /* 1) placement, rank 8 first */
        for (int y = 0; y < BOARD_SIZE; y++) {
            int empty = 0;
            for (int x = 0; x < BOARD_SIZE; x++) {
                Square sq = board.get(x, y);
                if (sq.isEmpty()) {
                    empty++;
                    continue;
                }
                if (empty != 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(sq.fenLetter());
            }
            if (empty != 0) sb.append(empty);
            if (y < BOARD_SIZE - 1) sb.append('/');
        }

        /* 2) active colour */
        sb.append(' ').append(state.turn().fenChar()).append(' ');

        /* 3) castling, fixed KQkq order */
        int before = sb.length();
        if (state.hasCastlingRight(Side.WHITE, KINGSIDE)) sb.append('K');
        if (state.hasCastlingRight(Side.WHITE, QUEENSIDE)) sb.append('Q');
        if (state.hasCastlingRight(Side.BLACK, KINGSIDE)) sb.append('k');
        if (state.hasCastlingRight(Side.BLACK, QUEENSIDE)) sb.append('q');
        if (sb.length() == before) sb.append('-');

        /* 4) en passant */
        Coord ep = state.enPassantTarget();
        sb.append(' ').append(ep == null ? "-" : ep.toAlgebraic());

        /* 5, 6) clocks */
        sb.append(' ').append(state.halfmoveClock()).append(' ').append(state.fullmoveNumber());
        return sb.toString();
    }

    @Override
    public GameState fromFen(String fen) {
        Objects.requireNonNull(fen, "FEN must not be null");
        String[] fields = fen.trim().split("\\s+");
        if (fields.length != FEN_FIELDS) {
            throw new MalformedFenException(fen, "expected " + FEN_FIELDS + " fields, got " + fields.length);
        }

        GameState state = new GameState(new Board());
        parsePlacement(fen, fields[0], state);
        state.setTurn(parseColour(fen, fields[1]));
        parseCastling(fen, fields[2], state);
        state.setEnPassantTarget(parseEnPassant(fen, fields[3], state.turn()));
        state.setHalfmoveClock(parseCounter(fen, fields[4], "halfmove clock"));
        state.setFullmoveNumber(parseCounter(fen, fields[5], "fullmove number"));
        return state;
    }

    /* ────── field parsers ────── */

    private static void parsePlacement(String fen, String field, GameState state) {
        String[] ranks = field.split("/", -1);
        if (ranks.length != BOARD_SIZE) {
            throw new MalformedFenException(fen, "expected " + BOARD_SIZE + " ranks, got " + ranks.length);
        }

        Board board = state.board();
        for (int y = 0; y < BOARD_SIZE; y++) {
            int x = 0;
            for (char c : ranks[y].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    x += c - '0';
                    if (x > BOARD_SIZE) break;
                    continue;
                }
                Optional<PieceKind> kind = PieceKind.fromLetter(c);
                if (kind.isEmpty()) throw new MalformedFenException(fen, "unknown piece '" + c + "'");
                if (x >= BOARD_SIZE) {
                    x++;
                    break;
                }

                Side side = Character.isUpperCase(c) ? Side.WHITE : Side.BLACK;
                Coord at = Coord.of(x, y);
                if (kind.get() == PieceKind.KING) {
                    if (state.kingCoord(side) != null) {
                        throw new MalformedFenException(fen, "more than one " + side + " king");
                    }
                    state.setKingCoord(side, at);
                }
                board.set(at, Square.of(kind.get(), side));
                x++;
            }
            if (x != BOARD_SIZE) {
                throw new MalformedFenException(fen, "rank " + (BOARD_SIZE - y) + " does not cover 8 files");
            }
        }
    }

    private static Side parseColour(String fen, String field) {
        return switch (field) {
            case "w" -> Side.WHITE;
            case "b" -> Side.BLACK;
            default -> throw new MalformedFenException(fen, "invalid active colour '" + field + "'");
        };
    }

    private static void parseCastling(String fen, String field, GameState state) {
        if (field.equals("-")) return;
        for (char c : field.toCharArray()) {
            Side side = Character.isUpperCase(c) ? Side.WHITE : Side.BLACK;
            int wing = switch (c) {
                case 'K', 'k' -> KINGSIDE;
                case 'Q', 'q' -> QUEENSIDE;
                default -> throw new MalformedFenException(fen, "invalid castling flag '" + c + "'");
            };
            if (state.hasCastlingRight(side, wing)) {
                throw new MalformedFenException(fen, "repeated castling flag '" + c + "'");
            }
            state.setCastlingRight(side, wing, true);
        }
    }

    /** The target lies behind a pawn of the side that just moved: rank 6 with White to move, rank 3 with Black. */
    private static Coord parseEnPassant(String fen, String field, Side toMove) {
        if (field.equals("-")) return null;
        Coord target;
        try {
            target = Coord.parse(field);
        } catch (IllegalArgumentException e) {
            throw new MalformedFenException(fen, "invalid en-passant square '" + field + "'", e);
        }
        int expectedRank = toMove == Side.WHITE ? 6 : 3;
        if (target.rank() != expectedRank) {
            throw new MalformedFenException(fen, "en-passant square '" + field + "' is not on rank " + expectedRank);
        }
        return target;
    }

    private static int parseCounter(String fen, String field, String what) {
        int value;
        try {
            value = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new MalformedFenException(fen, "invalid " + what + " '" + field + "'", e);
        }
        if (value < 0) throw new MalformedFenException(fen, "negative " + what + " '" + field + "'");
        return value;
    }
}
