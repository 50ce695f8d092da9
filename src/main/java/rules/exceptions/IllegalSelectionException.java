package rules.exceptions;

/**
 * The caller asked for moves of a square it may not select, or tried to play a destination
 * outside the square's legal set. Nothing is mutated when this is thrown.
 */
public class IllegalSelectionException extends IllegalStateException {

    public IllegalSelectionException(String message) {
        super(message);
    }
}
