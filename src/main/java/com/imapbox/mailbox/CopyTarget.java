package com.imapbox.mailbox;

/**
 * Destination of a copy or move, resolved once per call
 */
public sealed interface CopyTarget {

    /**
     * A folder reachable through the source's own session: server-side UID COPY
     */
    record SameServerFolder(String folderName) implements CopyTarget {
    }

    /**
     * Any other sink: the message is downloaded and added
     */
    record ForeignSink(MessageSink<?> sink) implements CopyTarget {
    }

    record Invalid(String reason) implements CopyTarget {
    }

    /**
     * Resolve a folder name, a mailbox or a sink against the source handle.
     * A mailbox on the same session becomes a {@link SameServerFolder}.
     */
    static CopyTarget resolve(Object target, MailboxHandle source) {
        if (target instanceof String name) {
            return name.isBlank() ? new Invalid("blank folder name") : new SameServerFolder(name);
        }
        if (target instanceof ImapMailbox<?> mailbox && mailbox.getHandle().isSameSession(source)) {
            return new SameServerFolder(mailbox.getFolderName());
        }
        if (target instanceof MessageSink<?> sink) {
            return new ForeignSink(sink);
        }
        return new Invalid(target == null ? "null target" : "target of type " + target.getClass().getName());
    }
}
