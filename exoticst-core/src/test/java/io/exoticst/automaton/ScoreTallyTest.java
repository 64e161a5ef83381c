package io.exoticst.automaton;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ScoreTallyTest {

    @Test
    void add_samePattern_shouldSum() {
        ScoreTally tally = new ScoreTally();

        tally.add("he", 1);
        tally.add("he", 4);
        tally.add("she", 3);

        assertThat(tally.toMap()).containsOnly(entry("he", 5L), entry("she", 3L));
    }

    @Test
    void toMap_shouldKeepFirstContributionOrder() {
        ScoreTally tally = new ScoreTally();

        tally.add("c", 1);
        tally.add("a", 1);
        tally.add("c", 1);
        tally.add("b", 1);

        assertThat(tally.toMap().keySet()).containsExactly("c", "a", "b");
    }

    @Test
    void toMap_empty_shouldBeEmptyAndUnmodifiable() {
        ScoreTally tally = new ScoreTally();

        Map<String, Long> map = tally.toMap();

        assertThat(map).isEmpty();
        assertThatThrownBy(() -> map.put("x", 1L)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toMap_shouldBeSnapshot() {
        ScoreTally tally = new ScoreTally();
        tally.add("a", 1);

        Map<String, Long> snapshot = tally.toMap();
        tally.add("a", 1);

        assertThat(snapshot).containsOnly(entry("a", 1L));
        assertThat(tally.toMap()).containsOnly(entry("a", 2L));
    }

    @Test
    void add_totalPastLongMax_shouldThrowInsteadOfWrapping() {
        ScoreTally tally = new ScoreTally();
        tally.add("a", Long.MAX_VALUE);

        assertThatThrownBy(() -> tally.add("a", 1))
                .isInstanceOfSatisfying(ScoreOverflowException.class, ex -> {
                    assertThat(ex.pattern()).isEqualTo("a");
                    assertThat(ex.getCause()).isInstanceOf(ArithmeticException.class);
                });
        assertThat(tally.toMap()).containsOnly(entry("a", Long.MAX_VALUE));
    }

    @Test
    void add_totalPastLongMin_shouldThrow() {
        ScoreTally tally = new ScoreTally();
        tally.add("a", Long.MIN_VALUE);

        assertThatThrownBy(() -> tally.add("a", -1)).isInstanceOf(ScoreOverflowException.class);
    }
}
