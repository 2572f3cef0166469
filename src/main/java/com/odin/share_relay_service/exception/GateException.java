package com.odin.share_relay_service.exception;

/**
 * The membership check itself failed. Treated as not authorized.
 */
public class GateException extends ShareRelayException {

    private static final long serialVersionUID = 1L;

    public GateException(String message) {
        super(message);
    }

    public GateException(String message, Throwable cause) {
        super(message, cause);
    }
}
