package rules.contracts;

import java.util.List;

/**
 * Named engine options, set with lines of the form
 * {@code setoption name <Name> value <Value>}.
 */
public interface RulesOptions {

    /**
     * Parses a "setoption" command line and applies the value.
     *
     * @return {@code false} if the line names no known option or carries an invalid value
     */
    boolean setOption(String line);

    /** One {@code option name … type … default …} line per option. */
    List<String> describeOptions();

    String getOptionValue(String name);

    /** Refuse castling out of check and let the b-file square be attacked. */
    boolean strictCastling();

    /** Evaluate the sixteen attack rays with a parallel stream. */
    boolean parallelAttackScan();
}
