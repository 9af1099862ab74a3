package io.uabridge.write;

/**
 * A literal could not be converted to the requested data type.
 */
public class ValueConversionException extends Exception {
    public ValueConversionException(String message) {
        super(message);
    }

    public ValueConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
