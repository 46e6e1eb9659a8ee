package com.imapbox.session;

/**
 * Completion status of a tagged IMAP response
 */
public enum ImapStatus {
    OK,
    NO,
    BAD
}
