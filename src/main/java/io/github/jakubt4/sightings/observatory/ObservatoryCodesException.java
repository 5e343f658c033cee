package io.github.jakubt4.sightings.observatory;

public class ObservatoryCodesException extends RuntimeException {

    public ObservatoryCodesException(final String message) {
        super(message);
    }

    public ObservatoryCodesException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
