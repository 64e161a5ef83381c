package io.exoticst.automaton;

import io.exoticst.core.ExoticstException;

/**
 * Thrown when an ordinal range does not lie inside {@code [0, patternCount - 1]}
 * or when {@code first > last}.
 */
public class OrdinalRangeException extends ExoticstException {

    private final int first;
    private final int last;
    private final int patternCount;

    public OrdinalRangeException(int first, int last, int patternCount) {
        super("Invalid ordinal range [" + first + ", " + last + "] for " + patternCount + " pattern(s)");
        this.first = first;
        this.last = last;
        this.patternCount = patternCount;
    }

    public int first() {
        return first;
    }

    public int last() {
        return last;
    }

    public int patternCount() {
        return patternCount;
    }
}
