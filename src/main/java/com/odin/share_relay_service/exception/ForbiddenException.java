package com.odin.share_relay_service.exception;

/**
 * The requester is not the owner of the share.
 */
public class ForbiddenException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }
}
