package io.github.depot2git;

/** The source system or the configuration produced a value the converter does not know how to handle. */
public class UnrecognizedInputException extends FatalConversionException {
    public UnrecognizedInputException(String message) {
        super(message);
    }

    public UnrecognizedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
