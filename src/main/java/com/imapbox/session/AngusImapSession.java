package com.imapbox.session;

import com.imapbox.config.ImapBoxProperties;
import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.ImapTransportException;
import com.imapbox.exception.NoSuchFolderException;
import jakarta.mail.Folder;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.iap.Argument;
import org.eclipse.angus.mail.iap.Response;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.eclipse.angus.mail.imap.protocol.BASE64MailboxEncoder;
import org.eclipse.angus.mail.imap.protocol.IMAPProtocol;
import org.eclipse.angus.mail.imap.protocol.IMAPResponse;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ImapSessionPort} on Eclipse Angus Mail.
 * <p>
 * Commands are issued raw through {@link IMAPFolder#doCommand} on the selected
 * folder; Angus' own message cache is never used. Untagged responses whose
 * keyword matches the command become {@link ResponseRecord}s.
 */
@Slf4j
public class AngusImapSession implements ImapSessionPort {

    private static final Pattern LITERAL = Pattern.compile("\\{(\\d+)}\r\n");

    private final Session mailSession;
    private final String protocol;
    private final ImapBoxProperties.Server server;

    private IMAPStore store;
    private IMAPFolder folder;

    public AngusImapSession(Session mailSession, String protocol, ImapBoxProperties.Server server) {
        this.mailSession = mailSession;
        this.protocol = protocol;
        this.server = server;
    }

    @Override
    public synchronized void login() {
        try {
            if (store == null) {
                store = (IMAPStore) mailSession.getStore(protocol);
            }
            if (!store.isConnected()) {
                store.connect(server.getHost(), server.getPort(), server.getUsername(), server.getPassword());
                log.info("IMAP login: {}@{}:{} ({})", server.getUsername(), server.getHost(), server.getPort(), protocol);
            }
        } catch (MessagingException e) {
            throw new ImapTransportException("Login to " + server.getHost() + ":" + server.getPort() + " failed", e);
        }
    }

    @Override
    public synchronized void reconnect() {
        if (store != null) {
            try {
                store.close();
            } catch (MessagingException e) {
                // a broken connection is the usual reason for reconnecting
                log.warn("Closing stale connection to {} failed: {}", server.getHost(), e.getMessage());
            }
        }
        store = null;
        folder = null;
        login();
    }

    @Override
    public synchronized void select(String folderName) {
        requireStore();
        try {
            closeFolder();
            IMAPFolder candidate = (IMAPFolder) store.getFolder(folderName);
            if (!candidate.exists()) {
                throw new NoSuchFolderException(folderName);
            }
            candidate.open(Folder.READ_WRITE);
            folder = candidate;
            log.debug("IMAP SELECT {}", folderName);
        } catch (FolderNotFoundException e) {
            throw new NoSuchFolderException(folderName);
        } catch (MessagingException e) {
            throw new ImapTransportException("SELECT " + folderName + " failed", e);
        }
    }

    @Override
    public synchronized void create(String folderName) {
        requireStore();
        try {
            if (!store.getFolder(folderName).create(Folder.HOLDS_MESSAGES)) {
                throw new ImapProtocolException(ImapStatus.NO, "CREATE " + folderName);
            }
            log.info("IMAP CREATE {}", folderName);
        } catch (MessagingException e) {
            throw new ImapTransportException("CREATE " + folderName + " failed", e);
        }
    }

    @Override
    public ImapResponse uid(String command, String... args) {
        String line = "UID " + command + (args.length > 0 ? " " + String.join(" ", args) : "");
        return execute(line, p -> null, command);
    }

    @Override
    public ImapResponse uidSearch(String criteria, String charset) {
        Charset javaCharset = charset == null ? null : Charset.forName(MimeUtility.javaCharset(charset));
        String line = charset == null ? "UID SEARCH" : "UID SEARCH CHARSET " + charset;
        return execute(line, p -> searchArguments(criteria, javaCharset), "SEARCH");
    }

    @Override
    public ImapResponse uidCopy(long uid, String folderName) {
        return execute("UID COPY", p -> {
            Argument args = new Argument();
            args.writeAtom(String.valueOf(uid));
            writeMailboxName(p, args, folderName);
            return args;
        }, "COPY");
    }

    @Override
    public ImapResponse append(String folderName, String flags, String internalDate, byte[] message) {
        return execute("APPEND", p -> {
            Argument args = new Argument();
            writeMailboxName(p, args, folderName);
            if (flags != null) {
                args.writeAtom(flags);
            }
            if (internalDate != null) {
                args.writeString(internalDate);
            }
            args.writeBytes(message);
            return args;
        }, "APPEND");
    }

    @Override
    public ImapResponse expunge() {
        return execute("EXPUNGE", p -> null, "EXPUNGE");
    }

    @Override
    public synchronized void close() {
        try {
            closeFolder();
        } catch (MessagingException e) {
            throw new ImapTransportException("CLOSE failed", e);
        }
    }

    @Override
    public synchronized void logout() {
        if (store == null) {
            return;
        }
        try {
            store.close();
            log.info("IMAP logout: {}@{}", server.getUsername(), server.getHost());
        } catch (MessagingException e) {
            throw new ImapTransportException("LOGOUT failed", e);
        } finally {
            store = null;
            folder = null;
        }
    }

    private synchronized ImapResponse execute(String line, Function<IMAPProtocol, Argument> arguments, String key) {
        if (folder == null || !folder.isOpen()) {
            throw new IllegalStateException("No folder selected for " + line);
        }
        log.debug("IMAP >> {}", line);
        try {
            Response[] responses = (Response[]) folder.doCommand(p -> p.command(line, arguments.apply(p)));
            return toImapResponse(responses, key);
        } catch (MessagingException e) {
            throw new ImapTransportException(line + " failed", e);
        }
    }

    private void closeFolder() throws MessagingException {
        if (folder != null && folder.isOpen()) {
            folder.close(false);
        }
        folder = null;
    }

    private void requireStore() {
        if (store == null || !store.isConnected()) {
            throw new IllegalStateException("Not logged in to " + server.getHost());
        }
    }

    /**
     * UTF-8 when the server accepts it, modified UTF-7 otherwise
     */
    private static void writeMailboxName(IMAPProtocol protocol, Argument args, String folderName) {
        if (protocol.supportsUtf8()) {
            args.writeString(folderName, StandardCharsets.UTF_8);
        } else {
            args.writeString(BASE64MailboxEncoder.encode(folderName));
        }
    }

    /**
     * Split search criteria into atoms, strings and parenthesised lists.
     * Quoted strings and non-ASCII atoms become strings in the charset;
     * the protocol sends those as literals when they are not plain ASCII.
     *
     * @throws IllegalArgumentException on unbalanced parentheses or an unterminated string
     */
    static Argument searchArguments(String criteria, Charset charset) {
        Deque<Argument> enclosing = new ArrayDeque<>();
        Argument current = new Argument();
        int length = criteria.length();
        int i = 0;
        while (i < length) {
            char c = criteria.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                enclosing.push(current);
                current = new Argument();
                i++;
            } else if (c == ')') {
                if (enclosing.isEmpty()) {
                    throw new IllegalArgumentException("Unbalanced ')' in search criteria: " + criteria);
                }
                Argument list = current;
                current = enclosing.pop();
                current.writeArgument(list);
                i++;
            } else if (c == '"') {
                StringBuilder value = new StringBuilder();
                i++;
                while (i < length && criteria.charAt(i) != '"') {
                    if (criteria.charAt(i) == '\\' && i + 1 < length) {
                        i++;
                    }
                    value.append(criteria.charAt(i));
                    i++;
                }
                if (i >= length) {
                    throw new IllegalArgumentException("Unterminated string in search criteria: " + criteria);
                }
                i++;
                writeSearchString(current, value.toString(), charset);
            } else {
                int start = i;
                while (i < length && !Character.isWhitespace(criteria.charAt(i))
                        && "()\"".indexOf(criteria.charAt(i)) < 0) {
                    i++;
                }
                String atom = criteria.substring(start, i);
                if (atom.chars().allMatch(ch -> ch < 0x80)) {
                    current.writeAtom(atom);
                } else {
                    writeSearchString(current, atom, charset);
                }
            }
        }
        if (!enclosing.isEmpty()) {
            throw new IllegalArgumentException("Unbalanced '(' in search criteria: " + criteria);
        }
        return current;
    }

    private static void writeSearchString(Argument args, String value, Charset charset) {
        if (charset == null) {
            args.writeString(value);
        } else {
            args.writeString(value, charset);
        }
    }

    static ImapResponse toImapResponse(Response[] responses, String key) {
        Response tagged = responses[responses.length - 1];
        ImapStatus status = tagged.isOK() ? ImapStatus.OK : tagged.isNO() ? ImapStatus.NO : ImapStatus.BAD;
        List<ResponseRecord> records = new ArrayList<>();
        for (int i = 0; i < responses.length - 1; i++) {
            if (responses[i] instanceof IMAPResponse ir && ir.keyEquals(key)) {
                records.add(toRecord(ir.toString(), key));
            }
        }
        return new ImapResponse(status, records);
    }

    /**
     * Strip "* " and the keyword from a raw untagged response and split out its first literal.
     * The raw text carries one byte per char.
     */
    static ResponseRecord toRecord(String raw, String key) {
        String text = raw.startsWith("* ") ? raw.substring(2) : raw;
        if (text.endsWith("\r\n")) {
            text = text.substring(0, text.length() - 2);
        }
        Matcher keyword = Pattern.compile("^(\\d+ )?" + Pattern.quote(key) + " ?", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        if (keyword.find()) {
            String number = keyword.group(1) == null ? "" : keyword.group(1);
            text = number + text.substring(keyword.end());
        }

        Matcher literal = LITERAL.matcher(text);
        if (!literal.find()) {
            return ResponseRecord.of(text);
        }
        int size = Integer.parseInt(literal.group(1));
        int start = literal.end();
        int end = Math.min(start + size, text.length());
        byte[] data = text.substring(start, end).getBytes(StandardCharsets.ISO_8859_1);
        String rest = text.substring(0, literal.end() - 2) + text.substring(end);
        return new ResponseRecord(rest, data);
    }
}
