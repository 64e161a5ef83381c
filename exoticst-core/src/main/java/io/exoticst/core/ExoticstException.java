package io.exoticst.core;

public class ExoticstException extends RuntimeException {

    public ExoticstException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExoticstException(String message) {
        super(message);
    }

}
