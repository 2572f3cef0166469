package com.odin.share_relay_service.exception;

/**
 * The share registry could not be read or written.
 */
public class PersistenceException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
