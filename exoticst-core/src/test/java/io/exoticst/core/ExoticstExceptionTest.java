package io.exoticst.core;

import io.exoticst.automaton.InvalidInputException;
import io.exoticst.automaton.OrdinalRangeException;
import io.exoticst.automaton.ScoreOverflowException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExoticstExceptionTest {

    @Test
    void automatonErrors_shouldShareUncheckedRoot() {
        assertThat(new InvalidInputException("x")).isInstanceOf(ExoticstException.class);
        assertThat(new OrdinalRangeException(2, 1, 3))
                .isInstanceOf(ExoticstException.class)
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Invalid ordinal range [2, 1] for 3 pattern(s)");
    }

    @Test
    void scoreOverflow_shouldKeepArithmeticCause() {
        var cause = new ArithmeticException("long overflow");

        var exception = new ScoreOverflowException("he", cause);

        assertThat(exception).isInstanceOf(ExoticstException.class);
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.pattern()).isEqualTo("he");
        assertThat(exception.getMessage()).isEqualTo("Total score of pattern 'he' overflows long");
    }
}
