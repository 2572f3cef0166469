package com.odin.share_relay_service.exception;

/**
 * An operation needs the upload session in another mode, e.g. an item arrived
 * before the principal started an upload.
 */
public class InvalidStateException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
