package com.mimecast.mailstore.pipe;

/**
 * An activation step was attempted twice or in the wrong state.
 * <p>Indicates a programming or configuration error, never a transient condition.
 */
public class AlreadyActiveException extends UpdatePipeException {

    public AlreadyActiveException(String message) {
        super(message);
    }
}
