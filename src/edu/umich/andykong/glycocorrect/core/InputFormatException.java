package edu.umich.andykong.glycocorrect.core;

/**
 * Thrown when an input dataset or library cannot be interpreted, e.g. because it lacks data columns or contains
 * non-numeric values.
 */
public class InputFormatException extends Exception {
    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
