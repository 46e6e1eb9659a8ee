package com.imapbox.cli;

import com.imapbox.config.ImapBoxProperties;
import com.imapbox.domain.MessageView;
import com.imapbox.mailbox.ImapMailbox;
import com.imapbox.service.MailboxBackupService;
import com.imapbox.service.MailboxDirectory;
import com.imapbox.service.MailboxSummaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line entry points:
 * - check &lt;mailbox&gt;: number of unseen messages
 * - summary &lt;mailbox&gt;: one line per unseen message
 * - backup &lt;mailbox&gt; [directory]: every message as an EML file
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailboxCommandRunner implements ApplicationRunner {

    static final String USAGE = "Usage: check <mailbox> | summary <mailbox> | backup <mailbox> [directory]";

    private final MailboxDirectory directory;
    private final MailboxSummaryService summaryService;
    private final MailboxBackupService backupService;
    private final ImapBoxProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (command.size() < 2) {
            log.info(USAGE);
            return;
        }
        String name = command.get(1);
        switch (command.get(0)) {
            case "check" -> check(name);
            case "summary" -> summary(name);
            case "backup" -> backup(name, command.size() > 2 ? command.get(2) : properties.getBackup().getBasePath());
            default -> log.warn("Unknown command: {}. {}", command.get(0), USAGE);
        }
    }

    int check(String name) {
        try (ImapMailbox<MessageView> mailbox = directory.open(name)) {
            int unseen = mailbox.unseenUndeleted().size();
            System.out.println(unseen == 0
                    ? "No unread messages"
                    : unseen + " unread message" + (unseen > 1 ? "s" : ""));
            return unseen;
        }
    }

    List<String> summary(String name) {
        try (ImapMailbox<MessageView> mailbox = directory.open(name)) {
            List<String> lines = summaryService.summary(mailbox, mailbox.unseenUndeleted(), false);
            lines.forEach(System.out::println);
            return lines;
        }
    }

    int backup(String name, String basePath) {
        try (ImapMailbox<MessageView> mailbox = directory.open(name)) {
            return backupService.backupToDirectory(mailbox, basePath);
        }
    }
}
