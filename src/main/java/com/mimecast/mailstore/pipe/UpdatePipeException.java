package com.mimecast.mailstore.pipe;

/**
 * Base exception for update pipe failures.
 */
public class UpdatePipeException extends Exception {

    /**
     * Constructs a new UpdatePipeException.
     *
     * @param message Error message.
     */
    public UpdatePipeException(String message) {
        super(message);
    }

    /**
     * Constructs a new UpdatePipeException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public UpdatePipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
