package io.github.depot2git;

/** Base class for every failure the conversion reports to its caller. */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
