package com.mimecast.mailstore.pipe;

/**
 * The raw storage engine update stream already has a reader, so it cannot be handed to the forwarder.
 */
public class AlreadyConsumingException extends UpdatePipeException {

    public AlreadyConsumingException(String message) {
        super(message);
    }
}
