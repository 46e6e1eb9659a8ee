package com.imapbox.exception;

import lombok.Getter;

/**
 * The addressed UID does not exist at the time of the call
 * (status was OK but the payload was empty).
 */
@Getter
public class NoSuchMessageException extends ImapBoxException {

    private final long uid;

    public NoSuchMessageException(long uid, String operation) {
        super("No message " + uid + " in " + operation);
        this.uid = uid;
    }
}
