package com.imapbox.service;

import com.imapbox.config.ImapBoxProperties;
import com.imapbox.domain.MessageView;
import com.imapbox.mailbox.ImapMailbox;
import com.imapbox.session.ImapSessionFactory;
import com.imapbox.session.ImapSessionPort;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.function.Function;

/**
 * Named mailboxes from configuration (imapbox.mailboxes.*).
 * Every opened mailbox gets its own session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxDirectory {

    private final ImapBoxProperties properties;
    private final ImapSessionFactory sessionFactory;
    private final MeterRegistry meterRegistry;

    public Set<String> names() {
        return properties.getMailboxes().keySet();
    }

    public boolean contains(String name) {
        return properties.getMailboxes().containsKey(name);
    }

    /**
     * Connect, log in and select the configured folder
     *
     * @throws IllegalArgumentException if the mailbox or its server is not configured
     */
    public ImapMailbox<MessageView> open(String name) {
        ImapBoxProperties.Mailbox config = properties.getMailboxes().get(name);
        if (config == null) {
            throw new IllegalArgumentException("Unknown mailbox: " + name);
        }
        ImapBoxProperties.Server server = properties.getServers().get(config.getServer());
        if (server == null) {
            throw new IllegalArgumentException("Unknown server '" + config.getServer() + "' for mailbox " + name);
        }

        ImapSessionPort session = sessionFactory.open(server);
        ImapMailbox<MessageView> mailbox = new ImapMailbox<>(
                session, config.getFolder(), config.isCreate(), Function.identity(), meterRegistry);
        if (config.getTrash() != null && !config.getTrash().isBlank()) {
            mailbox.setTrash(config.getTrash());
        }
        log.info("Mailbox {} opened: {} on {}", name, config.getFolder(), server.getHost());
        return mailbox;
    }
}
