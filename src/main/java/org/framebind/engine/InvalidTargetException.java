package org.framebind.engine;

/**
 * Thrown when a reassignment references a record that is not in the engine's sequence.
 * The sequence is left unchanged.
 */
public class InvalidTargetException extends RuntimeException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
