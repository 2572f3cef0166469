package com.odin.share_relay_service.exception;

/**
 * Share token unknown or already deleted.
 */
public class NotFoundException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
