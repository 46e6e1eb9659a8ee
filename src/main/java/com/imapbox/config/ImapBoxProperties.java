package com.imapbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * imapbox configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "imapbox")
public class ImapBoxProperties {

    /**
     * IMAP servers by name
     */
    private Map<String, Server> servers = new LinkedHashMap<>();

    /**
     * Named mailboxes: a folder on one of the servers
     */
    private Map<String, Mailbox> mailboxes = new LinkedHashMap<>();

    private Backup backup = new Backup();

    @Data
    public static class Server {
        private String host = "localhost";
        private int port = 993;
        private boolean ssl = true;
        private String username;
        private String password;
        private long connectionTimeout = 30000L;
        private long timeout = 300000L;
    }

    @Data
    public static class Mailbox {
        private String server;
        private String folder = "INBOX";
        private String trash; // null: discard sets \Deleted in place
        private boolean create = false;
    }

    @Data
    public static class Backup {
        private String basePath = "data/backup";
    }
}
