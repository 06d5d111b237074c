package io.github.depot2git;

/** An external command failed, timed out or returned an empty or garbled response. Eligible for retry. */
public class TransientCommandException extends ConversionException {
    public TransientCommandException(String message) {
        super(message);
    }

    public TransientCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
