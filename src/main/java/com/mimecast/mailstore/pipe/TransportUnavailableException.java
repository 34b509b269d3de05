package com.mimecast.mailstore.pipe;

/**
 * The replication transport cannot be bound or connected.
 * <p>Raised at activation time; the node may continue without replication.
 */
public class TransportUnavailableException extends UpdatePipeException {

    public TransportUnavailableException(String message) {
        super(message);
    }

    public TransportUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
