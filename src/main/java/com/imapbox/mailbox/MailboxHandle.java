package com.imapbox.mailbox;

import com.imapbox.session.ImapSessionPort;
import lombok.Getter;

/**
 * The (session, folder) pair a mailbox operates against.
 * The folder changes on switch; the session never does.
 */
@Getter
public class MailboxHandle {

    private final ImapSessionPort session;
    private volatile String folderName;

    public MailboxHandle(ImapSessionPort session, String folderName) {
        this.session = session;
        this.folderName = folderName;
    }

    void setFolderName(String folderName) {
        this.folderName = folderName;
    }

    public boolean isSameSession(MailboxHandle other) {
        return other != null && other.session == session;
    }

    @Override
    public String toString() {
        return folderName;
    }
}
