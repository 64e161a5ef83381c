package io.exoticst.automaton;

import io.exoticst.core.ExoticstException;

/**
 * Thrown when the total score of a pattern no longer fits in a {@code long}.
 */
public class ScoreOverflowException extends ExoticstException {

    private final String pattern;

    public ScoreOverflowException(String pattern, ArithmeticException cause) {
        super("Total score of pattern '" + pattern + "' overflows long", cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
