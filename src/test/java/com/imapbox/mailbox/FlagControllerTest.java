package com.imapbox.mailbox;

import com.imapbox.domain.ImapFlags;
import com.imapbox.exception.FlagUpdateException;
import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.MalformedResponseException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * FlagController tests against the in-memory session
 */
class FlagControllerTest {

    private InMemoryImapSession session;
    private FlagController flags;
    private long uid;

    @BeforeEach
    void setUp() {
        session = new InMemoryImapSession("INBOX");
        uid = session.put("INBOX", InMemoryImapSession.message("alice@example.com", "Hello", "Hi"));
        session.select("INBOX");
        flags = new FlagController(session);
    }

    @Test
    @DisplayName("No flags -> add flagged -> remove flagged")
    void testAddAndRemoveFlag() {
        assertThat(flags.getFlags(uid)).isEmpty();

        flags.addFlags(uid, "flagged");
        assertThat(flags.getFlags(uid)).containsExactly("flagged");

        flags.removeFlags(uid, "flagged");
        assertThat(flags.getFlags(uid)).isEmpty();
    }

    @Test
    @DisplayName("Each flag is a separate STORE request")
    void testAddFlagsOnePerRequest() {
        flags.addFlags(uid, ImapFlags.SEEN, ImapFlags.FLAGGED);

        assertThat(session.count("UID STORE " + uid + " +FLAGS")).isEqualTo(2);
        assertThat(flags.getFlags(uid)).containsExactlyInAnyOrder(ImapFlags.SEEN, ImapFlags.FLAGGED);
    }

    @Test
    @DisplayName("setFlags replaces the whole set in one request")
    void testSetFlags() {
        flags.addFlags(uid, ImapFlags.SEEN);

        flags.setFlags(uid, List.of(ImapFlags.ANSWERED, "$Label1"));

        assertThat(flags.getFlags(uid)).containsExactlyInAnyOrder(ImapFlags.ANSWERED, "$Label1");
        assertThat(session.count("UID STORE " + uid + " FLAGS")).isEqualTo(1);
    }

    @Test
    @DisplayName("Partial failure names the failed flag and keeps earlier ones applied")
    void testPartialFailure() {
        ImapSessionPort port = mock(ImapSessionPort.class);
        when(port.uid("STORE", "3", "+FLAGS", "(\\Seen)")).thenReturn(ImapResponse.ok());
        when(port.uid("STORE", "3", "+FLAGS", "(\\Flagged)")).thenReturn(ImapResponse.no());

        FlagController controller = new FlagController(port);

        assertThatThrownBy(() -> controller.addFlags(3, ImapFlags.SEEN, ImapFlags.FLAGGED, ImapFlags.DRAFT))
                .isInstanceOfSatisfying(FlagUpdateException.class, e -> {
                    assertThat(e.getFlag()).isEqualTo(ImapFlags.FLAGGED);
                    assertThat(e.getAppliedFlags()).containsExactly(ImapFlags.SEEN);
                    assertThat(e.getUid()).isEqualTo(3);
                });
    }

    @Test
    @DisplayName("Size and internal date")
    void testSizeAndInternalDate() {
        assertThat(flags.getSize(uid)).isEqualTo(session.contentOf("INBOX", uid).length());
        assertThat(flags.getInternalDate(uid))
                .isEqualTo(OffsetDateTime.of(2008, 6, 3, 11, 5, 30, 0, ZoneOffset.ofHours(2)));
    }

    @Test
    @DisplayName("Absent UID: NoSuchMessageException for size and date")
    void testAbsentUid() {
        assertThatThrownBy(() -> flags.getSize(99)).isInstanceOf(NoSuchMessageException.class);
        assertThatThrownBy(() -> flags.getInternalDate(99)).isInstanceOf(NoSuchMessageException.class);
    }

    @Test
    @DisplayName("Non-OK fetch: ImapProtocolException")
    void testProtocolError() {
        session.failOn("UID FETCH");

        assertThatThrownBy(() -> flags.getFlags(uid)).isInstanceOf(ImapProtocolException.class);
        assertThatThrownBy(() -> flags.getSize(uid)).isInstanceOf(ImapProtocolException.class);
    }

    @Test
    @DisplayName("Missing fields: MalformedResponseException")
    void testMalformed() {
        ImapSessionPort port = mock(ImapSessionPort.class);
        when(port.uid("FETCH", "3", "(FLAGS)")).thenReturn(ImapResponse.ok(ResponseRecord.of("1 (UID 3)")));
        when(port.uid("FETCH", "3", "(RFC822.SIZE)")).thenReturn(ImapResponse.ok(ResponseRecord.of("1 (UID 3 RFC822.SIZE x)")));
        when(port.uid("FETCH", "3", "(INTERNALDATE)"))
                .thenReturn(ImapResponse.ok(ResponseRecord.of("1 (UID 3 INTERNALDATE \"yesterday\")")));

        FlagController controller = new FlagController(port);

        assertThatThrownBy(() -> controller.getFlags(3)).isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> controller.getSize(3)).isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> controller.getInternalDate(3)).isInstanceOf(MalformedResponseException.class);
    }

    @Test
    @DisplayName("Size beyond the long range: MalformedResponseException")
    void testOversizedSize() {
        ImapSessionPort port = mock(ImapSessionPort.class);
        when(port.uid("FETCH", "3", "(RFC822.SIZE)"))
                .thenReturn(ImapResponse.ok(ResponseRecord.of("1 (UID 3 RFC822.SIZE 99999999999999999999)")));

        assertThatThrownBy(() -> new FlagController(port).getSize(3))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("99999999999999999999");
    }

    @Test
    @DisplayName("Unsolicited FETCH updates for other messages are ignored")
    void testUnsolicitedUpdatesIgnored() {
        ImapSessionPort port = mock(ImapSessionPort.class);
        when(port.uid("FETCH", "9", "(FLAGS)")).thenReturn(ImapResponse.ok(
                ResponseRecord.of("3 (FLAGS (\\Seen \\Deleted))"),
                ResponseRecord.of("4 (UID 12 FLAGS (\\Flagged))"),
                ResponseRecord.of("5 (UID 9 FLAGS ())")));
        when(port.uid("FETCH", "9", "(RFC822.SIZE)")).thenReturn(ImapResponse.ok(
                ResponseRecord.of("3 (FLAGS (\\Seen))"),
                ResponseRecord.of("5 (UID 9 RFC822.SIZE 2048)")));

        FlagController controller = new FlagController(port);

        assertThat(controller.getFlags(9)).isEmpty();
        assertThat(controller.getSize(9)).isEqualTo(2048);
    }

    @Test
    @DisplayName("Only an unsolicited update returned: NoSuchMessageException")
    void testOnlyUnsolicitedUpdate() {
        ImapSessionPort port = mock(ImapSessionPort.class);
        when(port.uid("FETCH", "9", "(FLAGS)"))
                .thenReturn(ImapResponse.ok(ResponseRecord.of("3 (FLAGS (\\Seen \\Deleted))")));

        assertThatThrownBy(() -> new FlagController(port).getFlags(9)).isInstanceOf(NoSuchMessageException.class);
    }
}
