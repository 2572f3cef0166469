package com.odin.share_relay_service.exception;

/**
 * A frame could not be delivered to the principal's connection.
 */
public class TransportException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
