package com.imapbox.mailbox;

import com.imapbox.domain.ImapFlags;
import com.imapbox.domain.MessageView;
import com.imapbox.exception.NoSuchMessageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageRetriever tests
 */
class MessageRetrieverTest {

    private InMemoryImapSession session;
    private MessageCache cache;
    private MessageRetriever<MessageView> retriever;
    private long uid;

    @BeforeEach
    void setUp() throws Exception {
        session = new InMemoryImapSession("INBOX");
        uid = session.put("INBOX", InMemoryImapSession.message("Alice <alice@example.com>", "Report", "Numbers"),
                ImapFlags.FLAGGED);
        session.select("INBOX");
        cache = new MessageCache(session, new SimpleMeterRegistry());
        retriever = new MessageRetriever<>(session, cache, new FlagController(session), Function.identity());
    }

    @Test
    @DisplayName("Full view combines content, flags, internal date and size")
    void testGetFull() throws Exception {
        MessageView view = retriever.getFull(uid);

        assertThat(view.getUid()).isEqualTo(uid);
        assertThat(view.isHeaderOnly()).isFalse();
        assertThat(view.getMessage().getSubject()).isEqualTo("Report");
        assertThat(view.hasFlag(ImapFlags.FLAGGED)).isTrue();
        assertThat(view.getInternalDate()).isEqualTo(InMemoryImapSession.DEFAULT_DATE);
        assertThat(view.getSize()).isEqualTo(session.contentOf("INBOX", uid).length());
        assertThat(new String(view.getRaw(), StandardCharsets.UTF_8)).contains("Numbers");
    }

    @Test
    @DisplayName("Header view does not touch the cache")
    void testHeaderBypassesCache() throws Exception {
        retriever.getFull(uid);

        MessageView header = retriever.getHeaderOnly(uid);

        assertThat(header.isHeaderOnly()).isTrue();
        assertThat(header.getMessage().getSubject()).isEqualTo("Report");
        assertThat(new String(header.getRaw(), StandardCharsets.UTF_8)).doesNotContain("Numbers");
        assertThat(cache.isCached(uid)).isTrue();
    }

    @Test
    @DisplayName("Header then full then full: one RFC822 download")
    void testHeaderThenFullDownloadsOnce() {
        retriever.getHeaderOnly(uid);
        retriever.getFull(uid);
        retriever.getFull(uid);

        assertThat(session.count("UID FETCH " + uid + " (RFC822)")).isEqualTo(1);
        assertThat(session.count("UID FETCH " + uid + " (BODY.PEEK[HEADER])")).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing UID short-circuits before flags, date and size")
    void testMissingUidShortCircuits() {
        assertThatThrownBy(() -> retriever.getFull(42)).isInstanceOf(NoSuchMessageException.class);
        assertThatThrownBy(() -> retriever.getHeaderOnly(42)).isInstanceOf(NoSuchMessageException.class);

        assertThat(session.count("UID FETCH 42 (FLAGS)")).isZero();
        assertThat(session.count("UID FETCH 42 (INTERNALDATE)")).isZero();
        assertThat(session.count("UID FETCH 42 (RFC822.SIZE)")).isZero();
    }

    @Test
    @DisplayName("Factory post-processes the assembled view")
    void testFactory() {
        MessageRetriever<String> subjects = new MessageRetriever<>(session, cache, new FlagController(session),
                view -> view.getUid() + ":" + view.getSize());

        assertThat(subjects.getFull(uid)).isEqualTo(uid + ":" + session.contentOf("INBOX", uid).length());
    }

    @Test
    @DisplayName("Body section fetch returns the first part and marks seen")
    void testBodySection() {
        byte[] body = retriever.getBodySection(uid, "1");

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("Numbers\r\n");
        assertThat(session.flagsOf("INBOX", uid)).contains(ImapFlags.SEEN);
        assertThat(retriever.getBodySection(42, "1")).isEmpty();
    }
}
