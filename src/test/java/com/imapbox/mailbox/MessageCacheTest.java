package com.imapbox.mailbox;

import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MessageCache unit tests
 */
@ExtendWith(MockitoExtension.class)
class MessageCacheTest {

    private static final byte[] MESSAGE_5 = "Subject: five\r\n\r\nbody 5\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MESSAGE_9 = "Subject: nine\r\n\r\nbody 9\r\n".getBytes(StandardCharsets.UTF_8);

    @Mock
    private ImapSessionPort session;

    private SimpleMeterRegistry registry;
    private MessageCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        cache = new MessageCache(session, registry);
    }

    private static ImapResponse fetched(long uid, byte[] data) {
        return ImapResponse.ok(new ResponseRecord("1 (UID " + uid + " RFC822 {" + data.length + "})", data));
    }

    @Test
    @DisplayName("Same UID twice: one RFC822 fetch, second call is a hit")
    void testCacheHit() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(fetched(5, MESSAGE_5));

        byte[] first = cache.fetchRaw(5);
        byte[] second = cache.fetchRaw(5);

        assertThat(first).isEqualTo(MESSAGE_5);
        assertThat(second).isEqualTo(MESSAGE_5).isNotSameAs(first);
        verify(session, times(1)).uid("FETCH", "5", "(RFC822)");
        assertThat(registry.counter("imapbox.cache.hit").count()).isEqualTo(1.0);
        assertThat(registry.counter("imapbox.cache.miss").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Different UID evicts the cached entry")
    void testCacheEviction() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(fetched(5, MESSAGE_5));
        when(session.uid("FETCH", "9", "(RFC822)")).thenReturn(fetched(9, MESSAGE_9));

        cache.fetchRaw(5);
        assertThat(cache.fetchRaw(9)).isEqualTo(MESSAGE_9);
        assertThat(cache.isCached(5)).isFalse();
        assertThat(cache.isCached(9)).isTrue();

        cache.fetchRaw(5);
        verify(session, times(2)).uid("FETCH", "5", "(RFC822)");
    }

    @Test
    @DisplayName("Empty OK response: NoSuchMessageException, nothing cached")
    void testNoSuchMessage() {
        when(session.uid("FETCH", "7", "(RFC822)")).thenReturn(ImapResponse.ok());

        assertThatThrownBy(() -> cache.fetchRaw(7))
                .isInstanceOf(NoSuchMessageException.class)
                .hasMessageContaining("7");
        assertThat(cache.isCached(7)).isFalse();
    }

    @Test
    @DisplayName("Non-OK status: ImapProtocolException")
    void testProtocolError() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(ImapResponse.no());

        assertThatThrownBy(() -> cache.fetchRaw(5))
                .isInstanceOf(ImapProtocolException.class)
                .isNotInstanceOf(NoSuchMessageException.class);
    }

    @Test
    @DisplayName("Unsolicited FETCH for another UID is ignored")
    void testUnsolicitedRecordSkipped() {
        ImapResponse response = ImapResponse.ok(
                ResponseRecord.of("2 (UID 9 FLAGS (\\Seen))"),
                new ResponseRecord("1 (UID 5 RFC822 {" + MESSAGE_5.length + "})", MESSAGE_5));
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(response);

        assertThat(cache.fetchRaw(5)).isEqualTo(MESSAGE_5);
    }

    @Test
    @DisplayName("invalidate() forces a refetch")
    void testInvalidate() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(fetched(5, MESSAGE_5));

        cache.fetchRaw(5);
        cache.invalidate();
        cache.fetchRaw(5);

        verify(session, times(2)).uid("FETCH", "5", "(RFC822)");
    }

    @Test
    @DisplayName("Writes to a returned array do not reach the cached copy")
    void testReturnedBytesAreCopies() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(fetched(5, MESSAGE_5.clone()));

        byte[] first = cache.fetchRaw(5);
        first[0] = 'X';

        assertThat(cache.fetchRaw(5)).isEqualTo(MESSAGE_5);
        assertThat(registry.counter("imapbox.cache.hit").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Literal in a record without a UID item: NoSuchMessageException")
    void testUidLessLiteralRejected() {
        when(session.uid("FETCH", "5", "(RFC822)")).thenReturn(ImapResponse.ok(
                new ResponseRecord("1 (RFC822 {" + MESSAGE_5.length + "})", MESSAGE_5)));

        assertThatThrownBy(() -> cache.fetchRaw(5)).isInstanceOf(NoSuchMessageException.class);
        assertThat(cache.isCached(5)).isFalse();
    }
}
