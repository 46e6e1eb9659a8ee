package com.imapbox.exception;

/**
 * Base class of all mailbox layer failures
 */
public class ImapBoxException extends RuntimeException {

    public ImapBoxException(String message) {
        super(message);
    }

    public ImapBoxException(String message, Throwable cause) {
        super(message, cause);
    }
}
