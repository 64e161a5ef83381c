package io.exoticst.automaton;

/**
 * One scored occurrence source: the ordinal of a pattern in the build input and its score.
 */
record ScoreEntry(int ordinal, long score) {

    ScoreEntry {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative");
        }
    }

    boolean within(int first, int last) {
        return first <= ordinal && ordinal <= last;
    }
}
