package com.imapbox.service;

import com.imapbox.domain.MessageView;
import com.imapbox.exception.ImapBoxException;
import com.imapbox.mailbox.ImapMailbox;
import com.imapbox.mailbox.MessageSink;
import com.imapbox.util.EmlDirectorySink;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Backup of a whole mailbox into another message sink.
 * IMAP attributes are kept in X-Imapbox-* header fields of each copy.
 */
@Slf4j
@Service
public class MailboxBackupService {

    public static final String FLAGS_HEADER = "X-Imapbox-Flags";
    public static final String INTERNAL_DATE_HEADER = "X-Imapbox-Internal-Date";

    /**
     * @return number of messages written
     */
    public int backup(ImapMailbox<MessageView> mailbox, MessageSink<?> target) {
        int count = 0;
        target.lock();
        try {
            for (MessageView message : mailbox) {
                stamp(message);
                target.add(message);
                count++;
            }
            target.flush();
        } finally {
            target.unlock();
        }
        log.info("Backup of {} to {}: {} messages", mailbox.getFolderName(), target, count);
        return count;
    }

    public int backupToDirectory(ImapMailbox<MessageView> mailbox, String basePath) {
        return backup(mailbox, new EmlDirectorySink(basePath));
    }

    void stamp(MessageView message) {
        try {
            message.getMessage().setHeader(FLAGS_HEADER, message.flagString());
            if (message.getInternalDate() != null) {
                message.getMessage().setHeader(INTERNAL_DATE_HEADER, message.internalDateString());
            }
        } catch (MessagingException e) {
            throw new ImapBoxException("Could not stamp message " + message.getUid(), e);
        }
    }
}
