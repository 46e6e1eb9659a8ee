package com.imapbox.exception;

/**
 * A copy/move target that is neither a folder name nor a message sink
 */
public class UnsupportedTargetException extends ImapBoxException {

    public UnsupportedTargetException(String message) {
        super(message);
    }
}
