package com.imapbox.exception;

/**
 * Connection level failure reported by the session (dropped connection,
 * login failure, I/O error). Reconnection is explicit and caller-invoked.
 */
public class ImapTransportException extends ImapBoxException {

    public ImapTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
