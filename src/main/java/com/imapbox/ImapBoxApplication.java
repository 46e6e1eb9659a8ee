package com.imapbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * imapbox
 *
 * IMAP folders as UID-keyed message collections
 * - UID search, fetch, flags, copy/move/discard/expunge
 * - Jakarta Mail (Angus) IMAP sessions
 * - Configured mailbox directory, backup and summary commands
 * - Micrometer metrics
 */
@SpringBootApplication
@EnableConfigurationProperties
public class ImapBoxApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImapBoxApplication.class, args);
    }
}
