package com.imapbox.session;

import com.imapbox.exception.NoSuchFolderException;

/**
 * The operations the mailbox layer needs from an IMAP session.
 * <p>
 * A session is strictly request/response on one connection: callers must not
 * issue concurrent requests on the same instance without external synchronization.
 * Timeouts and cancellation are whatever the implementation's transport provides.
 */
public interface ImapSessionPort {

    /**
     * Make the folder the active (selected) folder
     *
     * @throws NoSuchFolderException if the folder does not exist
     */
    void select(String folderName);

    void create(String folderName);

    /**
     * Issue {@code UID <command> <args...>} against the selected folder.
     * Arguments are sent as given, so they must be ASCII atoms or already quoted.
     */
    ImapResponse uid(String command, String... args);

    /**
     * {@code UID SEARCH [CHARSET <charset>] <criteria>}. Quoted strings in the
     * criteria, and non-ASCII atoms, are sent as strings in the charset.
     *
     * @param charset charset of the strings in the criteria, or null for ASCII
     */
    ImapResponse uidSearch(String criteria, String charset);

    /**
     * {@code UID COPY <uid> <folder>}, the folder name encoded like SELECT and APPEND encode it
     */
    ImapResponse uidCopy(long uid, String folderName);

    /**
     * APPEND a message to a folder.
     *
     * @param flags        parenthesised flag list, or null
     * @param internalDate {@code dd-MMM-yyyy HH:mm:ss Z}, unquoted, or null
     */
    ImapResponse append(String folderName, String flags, String internalDate, byte[] message);

    ImapResponse expunge();

    void close();

    void logout();

    void login();

    void reconnect();
}
