package com.odin.share_relay_service.exception;

/**
 * Items could not be moved into the item store. Nothing of the failed batch is kept.
 */
public class RelayException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
