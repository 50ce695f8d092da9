package rules.contracts;

/**
 * Line-oriented front-end that reads commands until "quit" or end of input.
 */
public interface ConsoleHandler {

    void runLoop();
}
