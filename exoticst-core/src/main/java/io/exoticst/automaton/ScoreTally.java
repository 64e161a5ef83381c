package io.exoticst.automaton;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-traversal accumulator of pattern scores.
 *
 * <p>Contributions are summed, never overwritten. A key exists only once it has
 * received a contribution, so a pattern that never matched is never reported with 0.
 * Keys keep the order of their first contribution.
 *
 * <p>Not thread-safe; every traversal owns its own instance.
 */
final class ScoreTally {

    private final Map<String, Long> totals = new LinkedHashMap<>();

    /**
     * @throws ScoreOverflowException if the pattern's total leaves the {@code long} range
     */
    void add(String pattern, long score) {
        try {
            totals.merge(pattern, score, Math::addExact);
        } catch (ArithmeticException e) {
            throw new ScoreOverflowException(pattern, e);
        }
    }

    Map<String, Long> toMap() {
        if (totals.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(totals));
    }
}
