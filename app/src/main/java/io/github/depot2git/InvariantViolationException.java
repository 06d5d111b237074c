package io.github.depot2git;

/** Persisted or in-memory state is inconsistent. Never retried. */
public class InvariantViolationException extends FatalConversionException {
    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
