package com.imapbox.mailbox;

import com.imapbox.domain.ImapFlags;
import com.imapbox.domain.MessageView;
import com.imapbox.exception.EmptyMailboxException;
import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.MalformedResponseException;
import com.imapbox.exception.NoSuchFolderException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.util.EmlParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A folder on an IMAP server presented as a collection of messages keyed by UID.
 * <p>
 * Membership, size and iteration are answered by a UID SEARCH on every call.
 * Iteration works on a snapshot of the UID list taken when the iterator is
 * created and resolves each UID lazily; server-side changes after the
 * snapshot are not reflected.
 * <p>
 * Methods that would replace a message in place ({@link #set}, {@link #update})
 * are not supported by IMAP and throw {@link UnsupportedOperationException}.
 * <p>
 * One instance per session. Not thread-safe: a session carries one request at a time
 * and the message cache is unsynchronized.
 *
 * @param <M> message representation produced by the factory
 */
@Slf4j
public class ImapMailbox<M> implements MessageSink<Long>, Iterable<M>, AutoCloseable {

    @Getter
    private final MailboxHandle handle;
    private final boolean create;
    private final MessageCache cache;
    private final UidSearch search;
    private final FlagController flagController;
    private final MessageRetriever<M> retriever;
    private final TransferOrchestrator transfers;

    /**
     * Bind to a folder, selecting it.
     *
     * @param create create the folder if it does not exist
     * @throws NoSuchFolderException if the folder is absent and create is false
     */
    public ImapMailbox(ImapSessionPort session, String folderName, boolean create,
            Function<MessageView, M> factory, MeterRegistry meterRegistry) {
        this.handle = new MailboxHandle(session, folderName);
        this.create = create;
        this.cache = new MessageCache(session, meterRegistry);
        this.search = new UidSearch(session);
        this.flagController = new FlagController(session);
        this.retriever = new MessageRetriever<>(session, cache, flagController, factory);
        this.transfers = new TransferOrchestrator(handle, search, flagController, retriever);
        selectFolder(folderName, create);
    }

    public static ImapMailbox<MessageView> open(ImapSessionPort session, String folderName) {
        return open(session, folderName, true);
    }

    public static ImapMailbox<MessageView> open(ImapSessionPort session, String folderName, boolean create) {
        return new ImapMailbox<>(session, folderName, create, Function.identity(), new SimpleMeterRegistry());
    }

    public static <M> ImapMailbox<M> open(ImapSessionPort session, String folderName, boolean create,
            Function<MessageView, M> factory) {
        return new ImapMailbox<>(session, folderName, create, factory, new SimpleMeterRegistry());
    }

    public String getFolderName() {
        return handle.getFolderName();
    }

    // ================================================================
    // Lifecycle
    // ================================================================

    /**
     * Expunge the current folder, then select another one on the same server
     */
    public void switchFolder(String folderName, boolean create) {
        flush();
        selectFolder(folderName, create);
        handle.setFolderName(folderName);
        cache.invalidate();
        log.info("Switched to mailbox {}", folderName);
    }

    /**
     * Renew the connection and re-select the current folder
     */
    public void reconnect() {
        ImapSessionPort session = handle.getSession();
        session.reconnect();
        session.login();
        selectFolder(handle.getFolderName(), create);
        cache.invalidate();
        log.info("Reconnected to mailbox {}", handle.getFolderName());
    }

    /**
     * Expunge, close the folder and log out
     */
    @Override
    public void close() {
        flush();
        handle.getSession().close();
        handle.getSession().logout();
        cache.invalidate();
    }

    private void selectFolder(String folderName, boolean createIfMissing) {
        ImapSessionPort session = handle.getSession();
        try {
            session.select(folderName);
        } catch (NoSuchFolderException e) {
            if (!createIfMissing) {
                throw e;
            }
            log.info("Creating mailbox {}", folderName);
            session.create(folderName);
            session.select(folderName);
        }
    }

    // ================================================================
    // Search
    // ================================================================

    public List<Long> search(String criteria) {
        return search.search(criteria);
    }

    public List<Long> search(String criteria, String charset) {
        return search.search(criteria, charset);
    }

    public List<Long> unseenUndeleted() {
        return search.unseenUndeleted();
    }

    public List<Long> allUndeleted() {
        return search.allUndeleted();
    }

    public boolean contains(long uid) {
        return search.search(UidSearch.ALL).contains(uid);
    }

    public int size() {
        return search.search(UidSearch.ALL).size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    // ================================================================
    // Read
    // ================================================================

    /**
     * @throws NoSuchMessageException if there is no message with that UID
     */
    public M get(long uid) {
        return retriever.getFull(uid);
    }

    public M getOrDefault(long uid, M defaultValue) {
        try {
            return get(uid);
        } catch (NoSuchMessageException e) {
            return defaultValue;
        }
    }

    /**
     * Header-only message; the body is not downloaded
     */
    public M getHeader(long uid) {
        return retriever.getHeaderOnly(uid);
    }

    public byte[] getRawBytes(long uid) {
        return cache.fetchRaw(uid);
    }

    public String getRawString(long uid) {
        return new String(cache.fetchRaw(uid), StandardCharsets.UTF_8);
    }

    public InputStream getRawStream(long uid) {
        return new ByteArrayInputStream(cache.fetchRaw(uid));
    }

    public byte[] getBodySection(long uid, String section) {
        return retriever.getBodySection(uid, section);
    }

    // ================================================================
    // Iteration (snapshot of the UID list, lazily resolved)
    // ================================================================

    public List<Long> keys() {
        return search.search(UidSearch.ALL);
    }

    public Iterator<Long> iterKeys() {
        return keys().iterator();
    }

    /**
     * Every message; downloads the whole folder
     */
    public List<M> values() {
        List<M> result = new ArrayList<>();
        iterValues().forEachRemaining(result::add);
        return result;
    }

    public Iterator<M> iterValues() {
        Iterator<Long> keys = iterKeys();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public M next() {
                return get(keys.next());
            }
        };
    }

    public List<Map.Entry<Long, M>> items() {
        List<Map.Entry<Long, M>> result = new ArrayList<>();
        iterItems().forEachRemaining(result::add);
        return result;
    }

    public Iterator<Map.Entry<Long, M>> iterItems() {
        Iterator<Long> keys = iterKeys();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public Map.Entry<Long, M> next() {
                long uid = keys.next();
                return Map.entry(uid, get(uid));
            }
        };
    }

    @Override
    public Iterator<M> iterator() {
        return iterValues();
    }

    // ================================================================
    // Mutation
    // ================================================================

    /**
     * Same as {@link #remove(long)}
     */
    public void delete(long uid) {
        remove(uid);
    }

    /**
     * IMAP has no in-place replacement; delete and add if that is what you want
     */
    public void set(long uid, M message) {
        throw new UnsupportedOperationException("Setting items in IMAP not supported");
    }

    public void update(Map<Long, M> messages) {
        throw new UnsupportedOperationException("Updating items in IMAP not supported");
    }

    /**
     * Append a message with its flags and internal date, then expunge.
     *
     * @return the highest UID in the folder afterwards: the appended message's UID
     * unless another client appended concurrently
     */
    @Override
    public Long add(MessageView message) {
        boolean noFlags = message.getFlags() == null || message.getFlags().isEmpty();
        return append(noFlags ? null : message.flagString(),
                message.internalDateString(), serialize(message.getMessage()));
    }

    public Long add(MimeMessage message) {
        Set<String> flags;
        try {
            flags = ImapFlags.fromJakarta(message.getFlags());
        } catch (MessagingException e) {
            throw new MalformedResponseException("Unreadable flags of message to add", e);
        }
        return append(flags.isEmpty() ? null : ImapFlags.toFlagList(flags), null, serialize(message));
    }

    public Long add(byte[] rfc822) {
        return append(null, null, rfc822);
    }

    private Long append(String flags, String internalDate, byte[] data) {
        ImapResponse response = handle.getSession().append(handle.getFolderName(), flags, internalDate, data);
        if (!response.isOk()) {
            throw new ImapProtocolException(response.status(), "APPEND " + handle.getFolderName());
        }
        flush();
        List<Long> uids = search.allUndeleted();
        if (uids.isEmpty()) {
            throw new MalformedResponseException("No UIDs in " + handle.getFolderName() + " after APPEND");
        }
        long uid = Collections.max(uids);
        log.debug("Appended {} bytes to {}, highest UID now {}", data.length, handle.getFolderName(), uid);
        return uid;
    }

    private static byte[] serialize(MimeMessage message) {
        try {
            return EmlParser.toBytes(message);
        } catch (MessagingException e) {
            throw new MalformedResponseException("Message could not be serialized", e);
        }
    }

    /**
     * Read, delete and expunge
     *
     * @throws NoSuchMessageException if there is no message with that UID
     */
    public M pop(long uid) {
        M message = get(uid);
        delete(uid);
        expunge();
        return message;
    }

    public M pop(long uid, M defaultValue) {
        try {
            return pop(uid);
        } catch (NoSuchMessageException e) {
            return defaultValue;
        }
    }

    /**
     * Read, delete and expunge the first message of the folder
     *
     * @throws EmptyMailboxException if the folder has no messages
     */
    public Map.Entry<Long, M> popItem() {
        expunge();
        List<Long> uids = search.search(UidSearch.ALL);
        if (uids.isEmpty()) {
            throw new EmptyMailboxException(handle.getFolderName());
        }
        long uid = uids.get(0);
        M message = get(uid);
        delete(uid);
        expunge();
        return Map.entry(uid, message);
    }

    public void clear() {
        transfers.clear();
    }

    // ================================================================
    // Transfers
    // ================================================================

    public void copy(long uid, String folderName) {
        transfers.copy(uid, folderName);
    }

    public void copy(long uid, MessageSink<?> target) {
        transfers.copy(uid, target);
    }

    public void move(long uid, String folderName) {
        transfers.move(uid, folderName);
    }

    public void move(long uid, MessageSink<?> target) {
        transfers.move(uid, target);
    }

    public void discard(long uid) {
        transfers.discard(uid);
    }

    /**
     * @throws NoSuchMessageException if there is no message with that UID
     */
    public void remove(long uid) {
        transfers.remove(uid);
    }

    public void expunge() {
        transfers.expunge();
    }

    /**
     * Equivalent to expunge()
     */
    @Override
    public void flush() {
        expunge();
    }

    /**
     * IMAP has no mailbox locking
     */
    @Override
    public void lock() {
    }

    @Override
    public void unlock() {
    }

    public void setTrash(String folderName) {
        transfers.setTrash(folderName);
    }

    public void setTrash(MessageSink<?> sink) {
        transfers.setTrash(sink);
    }

    public void clearTrash() {
        transfers.clearTrash();
    }

    public Object getTrash() {
        return transfers.getTrash();
    }

    // ================================================================
    // Flags
    // ================================================================

    public Set<String> getFlags(long uid) {
        return flagController.getFlags(uid);
    }

    public void setFlags(long uid, Collection<String> flags) {
        flagController.setFlags(uid, flags);
    }

    public void addFlags(long uid, String... flags) {
        flagController.addFlags(uid, flags);
    }

    public void removeFlags(long uid, String... flags) {
        flagController.removeFlags(uid, flags);
    }

    public long getSize(long uid) {
        return flagController.getSize(uid);
    }

    public OffsetDateTime getInternalDate(long uid) {
        return flagController.getInternalDate(uid);
    }

    @Override
    public String toString() {
        return "ImapMailbox[" + handle.getFolderName() + "]";
    }
}
