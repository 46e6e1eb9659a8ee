package com.imapbox.exception;

public class EmptyMailboxException extends ImapBoxException {

    public EmptyMailboxException(String folderName) {
        super("Mailbox " + folderName + " is empty");
    }
}
