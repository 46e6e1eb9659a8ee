package com.imapbox.session;

import com.imapbox.config.ImapBoxProperties;
import jakarta.mail.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Opens logged-in sessions for configured servers
 */
@Slf4j
@Component
public class ImapSessionFactory {

    public ImapSessionPort open(ImapBoxProperties.Server server) {
        String protocol = server.isSsl() ? "imaps" : "imap";
        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty("mail." + protocol + ".connectiontimeout", String.valueOf(server.getConnectionTimeout()));
        props.setProperty("mail." + protocol + ".timeout", String.valueOf(server.getTimeout()));
        props.setProperty("mail." + protocol + ".partialfetch", "false");

        AngusImapSession session = new AngusImapSession(Session.getInstance(props), protocol, server);
        session.login();
        return session;
    }
}
