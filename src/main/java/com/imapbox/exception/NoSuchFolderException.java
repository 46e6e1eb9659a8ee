package com.imapbox.exception;

import lombok.Getter;

/**
 * SELECT of a folder that does not exist on the server
 */
@Getter
public class NoSuchFolderException extends ImapBoxException {

    private final String folderName;

    public NoSuchFolderException(String folderName) {
        super("mailbox " + folderName + " does not exist.");
        this.folderName = folderName;
    }
}
