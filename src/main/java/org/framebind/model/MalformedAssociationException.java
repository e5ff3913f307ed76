package org.framebind.model;

/**
 * Thrown when a frame association or frame query carries an out-of-domain value,
 * such as a negative frame index. Raised before any mutation is attempted.
 */
public class MalformedAssociationException extends IllegalArgumentException {

    /**
     * Creates a new MalformedAssociationException with the given message.
     *
     * @param message description of the rejected value.
     */
    public MalformedAssociationException(String message) {
        super(message);
    }
}
