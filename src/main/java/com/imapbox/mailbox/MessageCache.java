package com.imapbox.mailbox;

import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-slot cache of the last fully fetched message.
 * <p>
 * Holds at most one (UID, RFC822 bytes) pair; a hit requires exact UID equality.
 * It exists so that a header read followed by a full read of the same UID
 * downloads the message once. Not thread-safe.
 */
@Slf4j
public class MessageCache {

    private static final String ITEMS = "(RFC822)";

    private final ImapSessionPort session;
    private final Counter hitCounter;
    private final Counter missCounter;

    private Long cachedUid;
    private byte[] cachedMessage;

    public MessageCache(ImapSessionPort session, MeterRegistry meterRegistry) {
        this.session = session;
        this.hitCounter = Counter.builder("imapbox.cache.hit")
                .description("Full message reads served from the single-slot cache")
                .register(meterRegistry);
        this.missCounter = Counter.builder("imapbox.cache.miss")
                .description("Full message reads that went to the server")
                .register(meterRegistry);
    }

    /**
     * RFC 822 bytes of the message with the given UID. Each call returns its own copy.
     *
     * @throws NoSuchMessageException if the server returns no data for the UID
     */
    public byte[] fetchRaw(long uid) {
        if (cachedUid != null && cachedUid == uid) {
            hitCounter.increment();
            log.debug("Cache hit for UID {}", uid);
            return cachedMessage.clone();
        }
        missCounter.increment();
        String command = FetchResponses.command(ITEMS, uid);
        log.debug("Cache miss, {}", command);

        ImapResponse response = FetchResponses.requireOk(
                session.uid("FETCH", String.valueOf(uid), ITEMS), command);
        ResponseRecord record = FetchResponses.find(response, uid);
        if (record == null || !record.hasLiteral()) {
            throw new NoSuchMessageException(uid, "fetchRaw");
        }
        cachedUid = uid;
        cachedMessage = record.literal();
        return cachedMessage.clone();
    }

    public boolean isCached(long uid) {
        return cachedUid != null && cachedUid == uid;
    }

    public void invalidate() {
        cachedUid = null;
        cachedMessage = null;
    }
}
