package io.github.jakubt4.sightings.service.decode;

import lombok.Getter;

/**
 * Raised when an 80-column record cannot be decoded. Recoverable at line level.
 */
@Getter
public class ObservationFormatException extends Exception {

    public enum ErrorKind {
        LENGTH,
        DATE,
        ANGLE,
        MAGNITUDE,
        UNKNOWN_SITE,
        OFFSET,
        MISMATCH
    }

    private final ErrorKind kind;

    public ObservationFormatException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public ObservationFormatException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
