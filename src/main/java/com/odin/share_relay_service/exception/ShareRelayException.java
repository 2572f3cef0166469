package com.odin.share_relay_service.exception;

/**
 * Root of the relay's failures. Every subclass is unchecked and is caught at the
 * smallest scope that can turn it into a user notice or an HTTP status.
 */
public class ShareRelayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ShareRelayException(String message) {
        super(message);
    }

    public ShareRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
