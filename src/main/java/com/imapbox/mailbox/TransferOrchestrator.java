package com.imapbox.mailbox;

import com.imapbox.domain.MessageView;
import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.exception.UnsupportedTargetException;
import com.imapbox.session.ImapResponse;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Copy, move, discard, remove and expunge.
 * <p>
 * Copies between folders of the same session use UID COPY (no download);
 * copies to any other sink download the message and add it to the sink.
 * Move is copy followed by setting \Deleted on the source and is not atomic:
 * after a failure between the two steps the message exists in both places.
 * Nothing here compensates for that.
 */
@Slf4j
@RequiredArgsConstructor
public class TransferOrchestrator {

    private final MailboxHandle handle;
    private final UidSearch search;
    private final FlagController flagController;
    private final MessageRetriever<?> retriever;

    /**
     * Folder name, mailbox or sink that receives discarded messages; null for in-place delete
     */
    @Getter
    private Object trash;

    public void setTrash(String folderName) {
        this.trash = folderName;
    }

    public void setTrash(MessageSink<?> sink) {
        this.trash = sink;
    }

    public void clearTrash() {
        this.trash = null;
    }

    public void copy(long uid, String folderName) {
        copy(uid, CopyTarget.resolve(folderName, handle));
    }

    public void copy(long uid, MessageSink<?> sink) {
        copy(uid, CopyTarget.resolve(sink, handle));
    }

    /**
     * @throws ImapProtocolException      if a same-server UID COPY is refused
     * @throws NoSuchMessageException     if the UID is absent (foreign targets)
     * @throws UnsupportedTargetException if the target cannot be interpreted
     */
    void copy(long uid, CopyTarget target) {
        if (target instanceof CopyTarget.SameServerFolder folder) {
            if (isSourceFolder(folder)) {
                log.debug("Copy of UID {} to its own folder {} skipped", uid, folder.folderName());
                return;
            }
            ImapResponse response = handle.getSession().uidCopy(uid, folder.folderName());
            if (!response.isOk()) {
                throw new ImapProtocolException(response.status(), "UID COPY " + uid + " " + folder.folderName());
            }
            log.debug("UID {} copied from {} to {}", uid, handle.getFolderName(), folder.folderName());
        } else if (target instanceof CopyTarget.ForeignSink foreign) {
            MessageView message = retriever.getFullView(uid);
            MessageSink<?> sink = foreign.sink();
            sink.lock();
            try {
                sink.add(message);
                sink.flush();
            } finally {
                sink.unlock();
            }
            log.debug("UID {} copied from {} to {}", uid, handle.getFolderName(), sink);
        } else if (target instanceof CopyTarget.Invalid invalid) {
            throw new UnsupportedTargetException("copy target is of unknown type: " + invalid.reason());
        }
    }

    public void move(long uid, String folderName) {
        move(uid, CopyTarget.resolve(folderName, handle));
    }

    public void move(long uid, MessageSink<?> sink) {
        move(uid, CopyTarget.resolve(sink, handle));
    }

    /**
     * Copy, then mark the source deleted unless the target is the source folder
     */
    void move(long uid, CopyTarget target) {
        copy(uid, target);
        if (target instanceof CopyTarget.SameServerFolder folder && isSourceFolder(folder)) {
            return;
        }
        flagController.markDeleted(uid);
    }

    /**
     * Move to the trash if one is configured, otherwise set \Deleted in place
     */
    public void discard(long uid) {
        if (trash == null) {
            flagController.markDeleted(uid);
            return;
        }
        log.info("Moving UID {} from {} to {}", uid, handle.getFolderName(), trash);
        move(uid, CopyTarget.resolve(trash, handle));
    }

    /**
     * Discard a UID that must currently exist
     *
     * @throws NoSuchMessageException if the UID is not in the folder
     */
    public void remove(long uid) {
        if (!search.search(UidSearch.ALL).contains(uid)) {
            throw new NoSuchMessageException(uid, "remove");
        }
        discard(uid);
    }

    /**
     * Permanently remove every message marked \Deleted
     */
    public void expunge() {
        ImapResponse response = handle.getSession().expunge();
        if (!response.isOk()) {
            throw new ImapProtocolException(response.status(), "EXPUNGE");
        }
        log.debug("Expunged {}", handle.getFolderName());
    }

    /**
     * Discard every undeleted message, then expunge
     */
    public void clear() {
        for (long uid : search.allUndeleted()) {
            discard(uid);
        }
        expunge();
        log.info("Cleared {}", handle.getFolderName());
    }

    private boolean isSourceFolder(CopyTarget.SameServerFolder folder) {
        return folder.folderName().equals(handle.getFolderName());
    }
}
