package rules.exceptions;

/**
 * FEN text that cannot be decoded. Recoverable: the position the caller held before the decode
 * attempt is left untouched.
 */
public class MalformedFenException extends IllegalArgumentException {

    private final String fen;

    public MalformedFenException(String fen, String reason) {
        super(reason + " in FEN \"" + fen + "\"");
        this.fen = fen;
    }

    public MalformedFenException(String fen, String reason, Throwable cause) {
        super(reason + " in FEN \"" + fen + "\"", cause);
        this.fen = fen;
    }

    /** The rejected input, verbatim. */
    public String getFen() {
        return fen;
    }
}
