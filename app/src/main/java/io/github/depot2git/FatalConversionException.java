package io.github.depot2git;

/**
 * A failure that aborts the run. Nothing is rolled back; the next invocation resumes from whatever state was
 * persisted before the failure.
 */
public class FatalConversionException extends ConversionException {
    public FatalConversionException(String message) {
        super(message);
    }

    public FatalConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
