package com.imapbox.exception;

/**
 * An OK response whose payload could not be parsed into the expected shape
 */
public class MalformedResponseException extends ImapBoxException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
