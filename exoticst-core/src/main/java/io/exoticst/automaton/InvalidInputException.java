package io.exoticst.automaton;

import io.exoticst.core.ExoticstException;

/**
 * Thrown when the inputs of {@link Automaton#build} or {@link Automaton#traverse}
 * are malformed: mismatched pattern/score lengths, null or empty patterns,
 * null scores or a null text.
 */
public class InvalidInputException extends ExoticstException {

    public InvalidInputException(String message) {
        super(message);
    }
}
