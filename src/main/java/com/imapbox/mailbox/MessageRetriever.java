package com.imapbox.mailbox;

import com.imapbox.domain.MessageView;
import com.imapbox.exception.MalformedResponseException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import com.imapbox.util.EmlParser;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Assembles {@link MessageView}s from a raw fetch, the flags, the size and
 * the internal date, then applies the message factory.
 * <p>
 * The raw fetch always comes first: a missing UID short-circuits the
 * flag/date/size requests. Full reads go through the {@link MessageCache};
 * header reads bypass it so they never evict a cached full message.
 *
 * @param <M> representation produced by the factory
 */
@Slf4j
@RequiredArgsConstructor
public class MessageRetriever<M> {

    private static final String HEADER_ITEMS = "(BODY.PEEK[HEADER])";

    private final ImapSessionPort session;
    private final MessageCache cache;
    private final FlagController flagController;
    private final Function<MessageView, M> factory;

    public M getFull(long uid) {
        return factory.apply(getFullView(uid));
    }

    public M getHeaderOnly(long uid) {
        return factory.apply(getHeaderView(uid));
    }

    /**
     * Full view without the factory applied
     */
    public MessageView getFullView(long uid) {
        byte[] raw = cache.fetchRaw(uid);
        return assemble(uid, raw, false);
    }

    /**
     * Header-only view without the factory applied
     */
    public MessageView getHeaderView(long uid) {
        String command = FetchResponses.command(HEADER_ITEMS, uid);
        ImapResponse response = FetchResponses.requireOk(
                session.uid("FETCH", String.valueOf(uid), HEADER_ITEMS), command);
        ResponseRecord record = FetchResponses.find(response, uid);
        if (record == null || !record.hasLiteral()) {
            throw new NoSuchMessageException(uid, "getHeader");
        }
        return assemble(uid, record.literal(), true);
    }

    /**
     * Bytes of one body section, e.g. "1" for the first MIME part.
     * A plain BODY fetch, so the server marks the message seen.
     *
     * @return the section, or an empty array if the server returned none
     */
    public byte[] getBodySection(long uid, String section) {
        String items = "(BODY[" + section + "])";
        ImapResponse response = FetchResponses.requireOk(
                session.uid("FETCH", String.valueOf(uid), items), FetchResponses.command(items, uid));
        ResponseRecord record = FetchResponses.find(response, uid);
        if (record == null || !record.hasLiteral()) {
            return new byte[0];
        }
        return record.literal();
    }

    private MessageView assemble(long uid, byte[] raw, boolean headerOnly) {
        MimeMessage message;
        try {
            message = EmlParser.parse(raw);
        } catch (MessagingException e) {
            throw new MalformedResponseException("Unparsable message content for UID " + uid, e);
        }
        MessageView view = MessageView.builder()
                .uid(uid)
                .message(message)
                .raw(raw)
                .flags(flagController.getFlags(uid))
                .internalDate(flagController.getInternalDate(uid))
                .size(flagController.getSize(uid))
                .headerOnly(headerOnly)
                .build();
        log.debug("Retrieved {}", view);
        return view;
    }
}
