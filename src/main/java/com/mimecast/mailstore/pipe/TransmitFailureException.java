package com.mimecast.mailstore.pipe;

/**
 * Publishing a single update to other nodes failed.
 * <p>Never retried and never fatal to local delivery.
 */
public class TransmitFailureException extends UpdatePipeException {

    public TransmitFailureException(String message) {
        super(message);
    }

    public TransmitFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
